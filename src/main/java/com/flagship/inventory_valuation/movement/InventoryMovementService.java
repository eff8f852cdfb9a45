package com.flagship.inventory_valuation.movement;

import com.flagship.inventory_valuation.costing.CostSourceType;
import com.flagship.inventory_valuation.costing.CostingService;
import com.flagship.inventory_valuation.costing.CreateCostLayerRequest;
import com.flagship.inventory_valuation.exception.InventoryException;
import com.flagship.inventory_valuation.exception.NotFoundException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.gl.GlDocumentType;
import com.flagship.inventory_valuation.gl.GlPostingResult;
import com.flagship.inventory_valuation.gl.GlPostingService;
import com.flagship.inventory_valuation.ledger.LedgerEntry;
import com.flagship.inventory_valuation.ledger.LedgerEntryReason;
import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import com.flagship.inventory_valuation.ledger.OnHandResult;
import com.flagship.inventory_valuation.ledger.RecordEntryRequest;
import com.flagship.inventory_valuation.ledger.StockLedgerService;
import com.flagship.inventory_valuation.lot.AllocationPlan;
import com.flagship.inventory_valuation.lot.CreateLotRequest;
import com.flagship.inventory_valuation.lot.Lot;
import com.flagship.inventory_valuation.lot.LotAllocation;
import com.flagship.inventory_valuation.lot.LotCreation;
import com.flagship.inventory_valuation.lot.LotService;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import com.flagship.inventory_valuation.reconciliation.StockReconciliationService;
import com.flagship.inventory_valuation.reconciliation.VarianceResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for stock movements.
 *
 * Each operation writes ledger entries, lot changes, cost layers and the GL
 * journal in the caller's transaction, so a failure anywhere (insufficient
 * stock, a locked period) leaves nothing behind.
 *
 * Retries are safe: every document is claimed once in
 * {@link MovementDocumentRegistry}. A repeated call returns the entries of
 * the first application with {@code replayed} set, and re-issues the GL call,
 * which is itself idempotent and picks up a posting that previously failed
 * for lack of configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryMovementService {

    private final StockLedgerService ledgerService;
    private final LotService lotService;
    private final CostingService costingService;
    private final GlPostingService glPostingService;
    private final StockReconciliationService reconciliationService;
    private final MovementDocumentRegistry documentRegistry;
    private final InventoryMetrics metrics;
    private final Clock clock;

    /**
     * Receives goods: a PURCHASE entry, an optional lot and a cost layer per line,
     * then Dr Inventory / Cr GRNI for the receipt total.
     */
    @Transactional
    public MovementResult receiveGoods(GoodsReceiptCommand command) {
        requireDocument(command.getOrgId(), command.getBranchId(), command.getReceiptId());
        requireLines(command.getLines());
        for (ReceiptLine line : command.getLines()) {
            requireItem(line.getItemId(), line.getLocationId());
            requirePositive(line.getQty());
            if (line.getUnitCost() == null || line.getUnitCost().signum() < 0) {
                throw new ValidationException("Unit cost cannot be negative");
            }
        }

        UUID orgId = command.getOrgId();
        UUID branchId = command.getBranchId();
        String receiptId = command.getReceiptId();

        return execute(MovementKind.GOODS_RECEIPT, receiptId, () -> {
            if (!claim(orgId, branchId, MovementKind.GOODS_RECEIPT, receiptId, command.getActorId())) {
                return replay(MovementKind.GOODS_RECEIPT, orgId, branchId, LedgerSourceType.GOODS_RECEIPT,
                    receiptId, Set.of(LedgerEntryReason.PURCHASE),
                    repost(GlDocumentType.GOODS_RECEIPT, orgId, branchId, receiptId, MovementKind.GOODS_RECEIPT,
                        command.getActorId()));
            }

            MovementResult.MovementResultBuilder result = MovementResult.builder()
                .kind(MovementKind.GOODS_RECEIPT)
                .sourceId(receiptId);
            BigDecimal total = BigDecimal.ZERO;
            int lineNo = 0;

            for (ReceiptLine line : command.getLines()) {
                lineNo++;
                LedgerEntry entry = ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                    .itemId(line.getItemId())
                    .locationId(line.getLocationId())
                    .qty(line.getQty())
                    .reason(LedgerEntryReason.PURCHASE)
                    .sourceType(LedgerSourceType.GOODS_RECEIPT)
                    .sourceId(receiptId)
                    .createdBy(command.getActorId())
                    .metadata(Map.of("line", lineNo, "unitCost", line.getUnitCost().toPlainString()))
                    .build());
                result.ledgerEntryId(entry.getId());

                UUID layerLotId = null;
                if (line.getLotNumber() != null && !line.getLotNumber().isBlank()) {
                    LotCreation creation = lotService.createLot(CreateLotRequest.builder()
                        .orgId(orgId)
                        .branchId(branchId)
                        .itemId(line.getItemId())
                        .locationId(line.getLocationId())
                        .lotNumber(line.getLotNumber())
                        .receivedQty(line.getQty())
                        .unitCost(line.getUnitCost())
                        .expiryDate(line.getExpiryDate())
                        .manufacturingDate(line.getManufacturingDate())
                        .supplierLotRef(line.getSupplierLotRef())
                        .sourceType(LedgerSourceType.GOODS_RECEIPT)
                        .sourceId(receiptId)
                        .createdBy(command.getActorId())
                        .build());
                    result.createdLotId(creation.getLot().getId());
                    if (!creation.isExisting()) {
                        layerLotId = creation.getLot().getId();
                    }
                }

                costingService.createCostLayer(orgId, branchId, command.getActorId(), CreateCostLayerRequest.builder()
                    .itemId(line.getItemId())
                    .locationId(line.getLocationId())
                    .lotId(layerLotId)
                    .qtyReceived(line.getQty())
                    .unitCost(line.getUnitCost())
                    .sourceType(CostSourceType.GOODS_RECEIPT)
                    .sourceId(lineSourceId(receiptId, lineNo))
                    .build());

                total = total.add(line.getQty().multiply(line.getUnitCost()));
            }

            documentRegistry.recordValue(orgId, MovementKind.GOODS_RECEIPT, receiptId, total);
            GlPostingResult gl = glPostingService.postGoodsReceipt(orgId, branchId, receiptId, total,
                command.getActorId());

            return result
                .onHandSnapshots(snapshots(branchId, itemLocations(command.getLines(), ReceiptLine::getItemId,
                    ReceiptLine::getLocationId)))
                .value(total)
                .glPosting(gl)
                .build();
        });
    }

    /**
     * Consumes stock for a sale or production run. Lots are drawn FEFO; stock
     * outside any lot covers a lot shortfall as long as the ledger allows it.
     */
    @Transactional
    public MovementResult depleteStock(DepletionCommand command) {
        requireDocument(command.getOrgId(), command.getBranchId(), command.getDepletionId());
        requireStockLines(command.getLines());
        LedgerEntryReason reason = command.getSourceType() == LedgerSourceType.PRODUCTION
            ? LedgerEntryReason.PRODUCTION_CONSUME
            : LedgerEntryReason.SALE;

        UUID orgId = command.getOrgId();
        String depletionId = command.getDepletionId();

        return execute(MovementKind.DEPLETION, depletionId, () -> {
            if (!claim(orgId, command.getBranchId(), MovementKind.DEPLETION, depletionId, command.getActorId())) {
                return replay(MovementKind.DEPLETION, orgId, command.getBranchId(), command.getSourceType(),
                    depletionId, Set.of(reason),
                    repost(GlDocumentType.DEPLETION, orgId, command.getBranchId(), depletionId,
                        MovementKind.DEPLETION, command.getActorId()));
            }
            return consume(MovementKind.DEPLETION, GlDocumentType.DEPLETION, orgId, command.getBranchId(),
                command.getSourceType(), reason, depletionId, command.getActorId(), null, command.getLines());
        });
    }

    @Transactional
    public MovementResult recordWaste(WasteCommand command) {
        requireDocument(command.getOrgId(), command.getBranchId(), command.getWasteId());
        requireStockLines(command.getLines());

        UUID orgId = command.getOrgId();
        String wasteId = command.getWasteId();

        return execute(MovementKind.WASTE, wasteId, () -> {
            if (!claim(orgId, command.getBranchId(), MovementKind.WASTE, wasteId, command.getActorId())) {
                return replay(MovementKind.WASTE, orgId, command.getBranchId(), LedgerSourceType.WASTAGE,
                    wasteId, Set.of(LedgerEntryReason.WASTAGE),
                    repost(GlDocumentType.WASTE, orgId, command.getBranchId(), wasteId, MovementKind.WASTE,
                        command.getActorId()));
            }
            return consume(MovementKind.WASTE, GlDocumentType.WASTE, orgId, command.getBranchId(),
                LedgerSourceType.WASTAGE, LedgerEntryReason.WASTAGE, wasteId, command.getActorId(),
                command.getNotes(), command.getLines());
        });
    }

    /**
     * Undoes a waste record: opposite ledger entries, consumed lot quantity
     * returned, and the waste journal reversed.
     */
    @Transactional
    public MovementResult voidWaste(UUID orgId, UUID branchId, String wasteId, UUID actorId) {
        requireDocument(orgId, branchId, wasteId);

        return execute(MovementKind.WASTE_VOID, wasteId, () -> {
            if (!documentRegistry.isApplied(orgId, MovementKind.WASTE, wasteId)) {
                throw new NotFoundException("Waste record not found: " + wasteId);
            }
            if (!claim(orgId, branchId, MovementKind.WASTE_VOID, wasteId, actorId)) {
                return replay(MovementKind.WASTE_VOID, orgId, branchId, LedgerSourceType.WASTAGE, wasteId,
                    Set.of(LedgerEntryReason.ADJUSTMENT),
                    glPostingService.voidWaste(orgId, branchId, wasteId, actorId));
            }

            MovementResult.MovementResultBuilder result = MovementResult.builder()
                .kind(MovementKind.WASTE_VOID)
                .sourceId(wasteId);
            List<LedgerEntry> originals = originalEntries(orgId, LedgerSourceType.WASTAGE, wasteId,
                LedgerEntryReason.WASTAGE);

            for (LedgerEntry original : originals) {
                LedgerEntry entry = ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                    .itemId(original.getItemId())
                    .locationId(original.getLocationId())
                    .qty(original.getQty().negate())
                    .reason(LedgerEntryReason.ADJUSTMENT)
                    .sourceType(LedgerSourceType.WASTAGE)
                    .sourceId(wasteId)
                    .notes("Void of waste " + wasteId)
                    .createdBy(actorId)
                    .metadata(Map.of("reverses", original.getId().toString()))
                    .build());
                result.ledgerEntryId(entry.getId());
            }

            for (LotAllocation allocation : lotService.getAllocationsForSource(LedgerSourceType.WASTAGE, wasteId)) {
                result.lotMutation(lotService.incrementLot(allocation.getLotId(), allocation.getAllocatedQty(),
                    LedgerSourceType.WASTAGE, wasteId, actorId));
            }
            costingService.restoreDraws(LedgerSourceType.WASTAGE, wasteId);

            BigDecimal value = documentRegistry.findValue(orgId, MovementKind.WASTE, wasteId).orElse(BigDecimal.ZERO);
            documentRegistry.recordValue(orgId, MovementKind.WASTE_VOID, wasteId, value);
            GlPostingResult gl = glPostingService.voidWaste(orgId, branchId, wasteId, actorId);

            return result
                .onHandSnapshots(snapshots(branchId, itemLocations(originals, LedgerEntry::getItemId,
                    LedgerEntry::getLocationId)))
                .value(value)
                .glPosting(gl)
                .build();
        });
    }

    /**
     * Returns received goods to the vendor. Fails with insufficient stock when
     * any of the received quantity has already been consumed.
     *
     * The receipt's cost layers stay in place but no longer hold stock, so
     * they drop out of WAC.
     */
    @Transactional
    public MovementResult voidGoodsReceipt(UUID orgId, UUID branchId, String receiptId, UUID actorId) {
        requireDocument(orgId, branchId, receiptId);

        return execute(MovementKind.GOODS_RECEIPT_VOID, receiptId, () -> {
            if (!documentRegistry.isApplied(orgId, MovementKind.GOODS_RECEIPT, receiptId)) {
                throw new NotFoundException("Goods receipt not found: " + receiptId);
            }
            if (!claim(orgId, branchId, MovementKind.GOODS_RECEIPT_VOID, receiptId, actorId)) {
                return replay(MovementKind.GOODS_RECEIPT_VOID, orgId, branchId, LedgerSourceType.GOODS_RECEIPT,
                    receiptId, Set.of(LedgerEntryReason.VENDOR_RETURN),
                    glPostingService.voidGoodsReceipt(orgId, branchId, receiptId, actorId));
            }

            MovementResult.MovementResultBuilder result = MovementResult.builder()
                .kind(MovementKind.GOODS_RECEIPT_VOID)
                .sourceId(receiptId);
            List<LedgerEntry> originals = originalEntries(orgId, LedgerSourceType.GOODS_RECEIPT, receiptId,
                LedgerEntryReason.PURCHASE);

            for (LedgerEntry original : originals) {
                LedgerEntry entry = ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                    .itemId(original.getItemId())
                    .locationId(original.getLocationId())
                    .qty(original.getQty().negate())
                    .reason(LedgerEntryReason.VENDOR_RETURN)
                    .sourceType(LedgerSourceType.GOODS_RECEIPT)
                    .sourceId(receiptId)
                    .notes("Void of goods receipt " + receiptId)
                    .createdBy(actorId)
                    .metadata(Map.of("reverses", original.getId().toString()))
                    .build());
                result.ledgerEntryId(entry.getId());
            }

            for (Lot lot : lotService.getLotsForSource(orgId, LedgerSourceType.GOODS_RECEIPT, receiptId)) {
                result.lotMutation(lotService.decrementLot(lot.getId(), lot.getReceivedQty(),
                    LedgerSourceType.VENDOR_RETURN, receiptId, 1));
            }
            costingService.drawReceiptLayers(orgId, receiptId);

            BigDecimal value = documentRegistry.findValue(orgId, MovementKind.GOODS_RECEIPT, receiptId)
                .orElse(BigDecimal.ZERO);
            documentRegistry.recordValue(orgId, MovementKind.GOODS_RECEIPT_VOID, receiptId, value);
            GlPostingResult gl = glPostingService.voidGoodsReceipt(orgId, branchId, receiptId, actorId);

            return result
                .onHandSnapshots(snapshots(branchId, itemLocations(originals, LedgerEntry::getItemId,
                    LedgerEntry::getLocationId)))
                .value(value)
                .glPosting(gl)
                .build();
        });
    }

    /**
     * Applies a stocktake: one COUNT_ADJUSTMENT per line whose count differs
     * from the ledger, lots drawn down FEFO for shrinkage, and a single journal
     * for the net variance value.
     */
    @Transactional
    public MovementResult applyStocktake(StocktakeCommand command) {
        requireDocument(command.getOrgId(), command.getBranchId(), command.getSessionId());
        requireLines(command.getLines());
        for (CountLine line : command.getLines()) {
            requireItem(line.getItemId(), line.getLocationId());
        }

        UUID orgId = command.getOrgId();
        UUID branchId = command.getBranchId();
        String sessionId = command.getSessionId();

        return execute(MovementKind.STOCKTAKE, sessionId, () -> {
            if (!claim(orgId, branchId, MovementKind.STOCKTAKE, sessionId, command.getActorId())) {
                return replay(MovementKind.STOCKTAKE, orgId, branchId, LedgerSourceType.COUNT_SESSION, sessionId,
                    Set.of(LedgerEntryReason.COUNT_ADJUSTMENT),
                    repost(GlDocumentType.STOCKTAKE, orgId, branchId, sessionId, MovementKind.STOCKTAKE,
                        command.getActorId()));
            }

            MovementResult.MovementResultBuilder result = MovementResult.builder()
                .kind(MovementKind.STOCKTAKE)
                .sourceId(sessionId);
            BigDecimal net = BigDecimal.ZERO;

            for (CountLine line : command.getLines()) {
                VarianceResult variance = reconciliationService.computeVariance(
                    line.getItemId(), line.getLocationId(), branchId, line.getCountedQty());
                result.variance(variance);
                if (!variance.hasVariance()) {
                    continue;
                }

                LedgerEntry entry = ledgerService.recordCountAdjustment(orgId, branchId, line.getItemId(),
                    line.getLocationId(), variance.getVarianceQty(), sessionId, command.getActorId());
                result.ledgerEntryId(entry.getId());

                if (variance.getVarianceQty().signum() < 0) {
                    AllocationPlan plan = lotService.allocateFEFO(orgId, branchId, line.getItemId(),
                        line.getLocationId(), variance.getVarianceQty().abs(), false);
                    result.lotMutations(lotService.applyAllocation(plan, LedgerSourceType.COUNT_SESSION,
                        sessionId, entry.getId()));
                    if (plan.getShortfall().signum() > 0) {
                        costingService.drawUntrackedLayers(line.getItemId(), line.getLocationId(),
                            plan.getShortfall(), LedgerSourceType.COUNT_SESSION, sessionId);
                    }
                }
                net = net.add(variance.getVarianceValue());
            }

            documentRegistry.recordValue(orgId, MovementKind.STOCKTAKE, sessionId, net);
            GlPostingResult gl = glPostingService.postStocktake(orgId, branchId, sessionId, net,
                command.getActorId());

            return result
                .onHandSnapshots(snapshots(branchId, itemLocations(command.getLines(), CountLine::getItemId,
                    CountLine::getLocationId)))
                .value(net)
                .glPosting(gl)
                .build();
        });
    }

    private MovementResult consume(MovementKind kind, GlDocumentType documentType, UUID orgId, UUID branchId,
                                   LedgerSourceType sourceType, LedgerEntryReason reason, String sourceId,
                                   UUID actorId, String notes, List<StockLine> lines) {
        MovementResult.MovementResultBuilder result = MovementResult.builder()
            .kind(kind)
            .sourceId(sourceId);
        BigDecimal value = BigDecimal.ZERO;

        for (StockLine line : lines) {
            // Issued at the average cost of the stock on hand before this line leaves it
            BigDecimal wac = costingService.getWac(line.getItemId());
            LedgerEntry entry = ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                .itemId(line.getItemId())
                .locationId(line.getLocationId())
                .qty(line.getQty().negate())
                .reason(reason)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .notes(notes)
                .createdBy(actorId)
                .build());
            result.ledgerEntryId(entry.getId());

            AllocationPlan plan = lotService.allocateFEFO(orgId, branchId, line.getItemId(), line.getLocationId(),
                line.getQty());
            if (!plan.isFullyAllocated()) {
                log.warn("Lots cover {} of {} for item={}, location={}; {} taken from untracked stock",
                    plan.getTotalAllocated(), line.getQty(), line.getItemId(), line.getLocationId(),
                    plan.getShortfall());
            }
            result.lotMutations(lotService.applyAllocation(plan, sourceType, sourceId, entry.getId()));
            if (plan.getShortfall().signum() > 0) {
                costingService.drawUntrackedLayers(line.getItemId(), line.getLocationId(), plan.getShortfall(),
                    sourceType, sourceId);
            }
            value = value.add(line.getQty().multiply(wac));
        }

        documentRegistry.recordValue(orgId, kind, sourceId, value);
        GlPostingResult gl = glPostingService.post(documentType, orgId, branchId, sourceId, value, actorId);

        return result
            .onHandSnapshots(snapshots(branchId, itemLocations(lines, StockLine::getItemId, StockLine::getLocationId)))
            .value(value)
            .glPosting(gl)
            .build();
    }

    private MovementResult replay(MovementKind kind, UUID orgId, UUID branchId, LedgerSourceType sourceType,
                                  String sourceId, Set<LedgerEntryReason> reasons, GlPostingResult gl) {
        log.info("{} {} already applied, returning the original entries", kind, sourceId);
        List<LedgerEntry> entries = ledgerService.getEntriesForSource(orgId, sourceType, sourceId).stream()
            .filter(e -> reasons.contains(e.getReason()))
            .toList();
        return MovementResult.builder()
            .kind(kind)
            .sourceId(sourceId)
            .replayed(true)
            .ledgerEntryIds(entries.stream().map(LedgerEntry::getId).toList())
            .onHandSnapshots(snapshots(branchId, itemLocations(entries, LedgerEntry::getItemId,
                LedgerEntry::getLocationId)))
            .value(documentRegistry.findValue(orgId, kind, sourceId).orElse(null))
            .glPosting(gl)
            .build();
    }

    private GlPostingResult repost(GlDocumentType type, UUID orgId, UUID branchId, String sourceId,
                                   MovementKind kind, UUID actorId) {
        return documentRegistry.findValue(orgId, kind, sourceId)
            .map(value -> glPostingService.post(type, orgId, branchId, sourceId, value, actorId))
            .orElseGet(() -> GlPostingResult.skipped("No value recorded for " + sourceId));
    }

    private boolean claim(UUID orgId, UUID branchId, MovementKind kind, String sourceId, UUID actorId) {
        return documentRegistry.claim(orgId, branchId, kind, sourceId, actorId, Instant.now(clock));
    }

    private List<LedgerEntry> originalEntries(UUID orgId, LedgerSourceType sourceType, String sourceId,
                                              LedgerEntryReason reason) {
        List<LedgerEntry> originals = ledgerService.getEntriesForSource(orgId, sourceType, sourceId).stream()
            .filter(e -> e.getReason() == reason)
            .toList();
        if (originals.isEmpty()) {
            throw new NotFoundException("No " + reason + " entries for " + sourceType + " " + sourceId);
        }
        return originals;
    }

    private List<OnHandResult> snapshots(UUID branchId, Map<UUID, Set<UUID>> itemLocations) {
        List<OnHandResult> snapshots = new ArrayList<>();
        itemLocations.forEach((itemId, locations) -> locations.forEach(locationId ->
            snapshots.add(new OnHandResult(itemId, locationId, branchId,
                ledgerService.getOnHand(itemId, locationId, branchId)))));
        return snapshots;
    }

    private static <T> Map<UUID, Set<UUID>> itemLocations(List<T> lines,
                                                          Function<T, UUID> item,
                                                          Function<T, UUID> location) {
        Map<UUID, Set<UUID>> result = new LinkedHashMap<>();
        for (T line : lines) {
            result.computeIfAbsent(item.apply(line), k -> new LinkedHashSet<>()).add(location.apply(line));
        }
        return result;
    }

    private MovementResult execute(MovementKind kind, String sourceId, Supplier<MovementResult> operation) {
        long startTime = System.currentTimeMillis();
        MDC.put("sourceId", sourceId);
        try {
            MovementResult result = operation.get();
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordMovementLatency(kind.name().toLowerCase(), duration);
            log.info("{} {} applied: entries={}, value={}, gl={}, duration={}ms",
                kind, sourceId, result.getLedgerEntryIds().size(), result.getValue(),
                result.getGlPosting() != null ? result.getGlPosting().getStatus() : null, duration);
            return result;
        } catch (InventoryException e) {
            metrics.recordMovementLatency(kind.name().toLowerCase(), System.currentTimeMillis() - startTime);
            log.warn("{} {} rejected: code={}, error={}", kind, sourceId, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordMovementLatency(kind.name().toLowerCase(), System.currentTimeMillis() - startTime);
            log.error("{} {} failed: error={}", kind, sourceId, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("sourceId");
        }
    }

    static String lineSourceId(String documentId, int lineNo) {
        return documentId + "#" + lineNo;
    }

    private static void requireDocument(UUID orgId, UUID branchId, String documentId) {
        if (orgId == null || branchId == null) {
            throw new ValidationException("Org and branch are required");
        }
        if (documentId == null || documentId.isBlank()) {
            throw new ValidationException("Document id is required");
        }
    }

    private static void requireLines(List<?> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("At least one line is required");
        }
    }

    private static void requireStockLines(List<StockLine> lines) {
        requireLines(lines);
        for (StockLine line : lines) {
            requireItem(line.getItemId(), line.getLocationId());
            requirePositive(line.getQty());
        }
    }

    private static void requireItem(UUID itemId, UUID locationId) {
        if (itemId == null || locationId == null) {
            throw new ValidationException("Item and location are required on every line");
        }
    }

    private static void requirePositive(BigDecimal qty) {
        if (qty == null || qty.signum() <= 0) {
            throw new ValidationException("Line quantity must be positive");
        }
    }
}
