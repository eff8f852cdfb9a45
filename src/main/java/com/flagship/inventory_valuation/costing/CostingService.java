package com.flagship.inventory_valuation.costing;

import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import com.flagship.inventory_valuation.ledger.OnHandResult;
import com.flagship.inventory_valuation.ledger.StockLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Weighted-average costing.
 *
 * WAC is always computed from the stored cost layers; nothing caches it.
 * All arithmetic stays in BigDecimal and is never rounded here.
 */
@Service
@Slf4j
public class CostingService {

    private final CostLayerRepository costLayerRepository;
    private final RecipeProvider recipeProvider;
    private final StockLedgerService ledgerService;
    private final Clock clock;

    public CostingService(CostLayerRepository costLayerRepository,
                          RecipeProvider recipeProvider,
                          StockLedgerService ledgerService,
                          Clock clock) {
        this.costLayerRepository = costLayerRepository;
        this.recipeProvider = recipeProvider;
        this.ledgerService = ledgerService;
        this.clock = clock;
    }

    /**
     * WAC of an item over the stock still on hand: each layer weighted by its
     * remaining quantity. Zero when no layer has any left.
     */
    public BigDecimal getWac(UUID itemId) {
        return costLayerRepository.totalsForItem(itemId).wac();
    }

    /**
     * WAC of an item using only the remaining stock of layers received at one location.
     */
    public BigDecimal getWac(UUID itemId, UUID locationId) {
        return costLayerRepository.totalsForItemAtLocation(itemId, locationId).wac();
    }

    /**
     * Records the cost of a receiving event.
     *
     * Idempotent per (org, sourceType, sourceId): a retried call returns the
     * layer written the first time.
     */
    @Transactional
    public CostLayer createCostLayer(UUID orgId, UUID branchId, UUID actorId, CreateCostLayerRequest request) {
        validate(request);

        CostTotals before = costLayerRepository.totalsForItem(request.getItemId());
        BigDecimal priorWac = before.wac();
        BigDecimal newWac = before.plus(request.getQtyReceived(), request.getUnitCost()).wac();

        CostLayer candidate = new CostLayer(
            UUID.randomUUID(),
            orgId,
            branchId,
            request.getItemId(),
            request.getLocationId(),
            request.getLotId(),
            request.getQtyReceived(),
            request.getQtyReceived(),
            request.getUnitCost(),
            priorWac,
            newWac,
            request.getSourceType(),
            request.getSourceId(),
            request.getNotes(),
            actorId,
            Instant.now(clock)
        );

        return costLayerRepository.insertIfAbsent(candidate)
            .map(layer -> {
                log.info("Cost layer {} created: item={}, qty={}, unitCost={}, wac {} -> {}",
                    layer.getId(), layer.getItemId(), layer.getQtyReceived(), layer.getUnitCost(),
                    priorWac, newWac);
                return layer;
            })
            .orElseGet(() -> {
                log.debug("Cost layer for {} {} already exists", request.getSourceType(), request.getSourceId());
                return costLayerRepository.findBySource(orgId, request.getSourceType(), request.getSourceId())
                    .orElseThrow(() -> new IllegalStateException(
                        "Cost layer conflict without a row: " + request.getSourceId()));
            });
    }

    /**
     * Takes stock out of the lot-less layers at a position, oldest first. Lot
     * layers follow their lot and are never drawn here. Quantity beyond what
     * these layers hold has no recorded cost and stays undrawn.
     *
     * @return the quantity drawn
     */
    @Transactional
    public BigDecimal drawUntrackedLayers(UUID itemId, UUID locationId, BigDecimal qty,
                                          LedgerSourceType sourceType, String sourceId) {
        BigDecimal left = qty;
        for (CostLayer layer : costLayerRepository.findOpenUntrackedForUpdate(itemId, locationId)) {
            if (left.signum() <= 0) {
                break;
            }
            BigDecimal take = left.min(layer.getQtyRemaining());
            costLayerRepository.insertDraw(layer.getId(), take, sourceType.name(), sourceId, Instant.now(clock));
            left = left.subtract(take);
        }
        BigDecimal drawn = qty.subtract(left);
        if (left.signum() > 0) {
            log.debug("No cost layer holds {} of item={}, location={} for {} {}",
                left, itemId, locationId, sourceType, sourceId);
        }
        return drawn;
    }

    /**
     * Puts back everything a document drew from lot-less layers. A second call
     * finds nothing left to return.
     *
     * @return the quantity returned
     */
    @Transactional
    public BigDecimal restoreDraws(LedgerSourceType sourceType, String sourceId) {
        BigDecimal restored = BigDecimal.ZERO;
        for (Map.Entry<UUID, BigDecimal> draw : costLayerRepository.netDrawsForSource(sourceType.name(), sourceId)
                .entrySet()) {
            costLayerRepository.insertDraw(draw.getKey(), draw.getValue().negate(), sourceType.name(), sourceId,
                Instant.now(clock));
            restored = restored.add(draw.getValue());
        }
        return restored;
    }

    /**
     * Removes the lot-less layers of a returned receipt from stock. Whatever
     * of a layer was already drawn is taken from other lot-less layers at the
     * same position, since the ledger has let the return through.
     */
    @Transactional
    public void drawReceiptLayers(UUID orgId, String receiptId) {
        for (CostLayer layer : costLayerRepository.findUntrackedForReceipt(orgId, receiptId)) {
            BigDecimal own = layer.getQtyRemaining().max(BigDecimal.ZERO);
            if (own.signum() > 0) {
                costLayerRepository.insertDraw(layer.getId(), own, LedgerSourceType.VENDOR_RETURN.name(),
                    receiptId, Instant.now(clock));
            }
            BigDecimal elsewhere = layer.getQtyReceived().subtract(own);
            if (elsewhere.signum() > 0) {
                drawUntrackedLayers(layer.getItemId(), layer.getLocationId(), elsewhere,
                    LedgerSourceType.VENDOR_RETURN, receiptId);
            }
        }
    }

    public List<CostLayer> getCostLayerHistory(UUID orgId, UUID itemId, int limit) {
        return costLayerRepository.findByItem(orgId, itemId, limit);
    }

    /**
     * Cost of one unit of the target: base ingredients plus the ingredients of
     * every selected modifier, each priced at current WAC. Lines of unselected
     * modifiers are left out entirely.
     */
    public BigDecimal getRecipeCost(UUID targetId, List<ModifierSelection> selectedModifiers) {
        Set<UUID> selected = selectedModifiers == null ? Set.of() : selectedModifiers.stream()
            .filter(ModifierSelection::isSelected)
            .map(ModifierSelection::getModifierOptionId)
            .collect(Collectors.toSet());

        Map<UUID, BigDecimal> wacByItem = new HashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (RecipeIngredient ingredient : recipeProvider.getIngredients(targetId)) {
            if (!ingredient.isBase() && !selected.contains(ingredient.getModifierOptionId())) {
                continue;
            }
            BigDecimal wac = wacByItem.computeIfAbsent(ingredient.getItemId(), this::getWac);
            total = total.add(ingredient.getQtyPerUnit().multiply(wac));
        }
        return total;
    }

    /**
     * Cost and margin of a sold line.
     */
    public ItemCosting calculateItemCosting(ItemCostingRequest request) {
        if (request.getQuantity() == null || request.getUnitPrice() == null) {
            throw new ValidationException("Quantity and unit price are required");
        }
        BigDecimal costUnit = getRecipeCost(request.getTargetId(), request.getModifiers());
        ItemCosting costing = ItemCosting.of(
            costUnit,
            request.getQuantity(),
            request.getUnitPrice(),
            orZero(request.getModifiersPrice()),
            orZero(request.getDiscount()));
        log.debug("Costed target={}: costUnit={}, marginPct={}",
            request.getTargetId(), costing.getCostUnit(), costing.getMarginPct());
        return costing;
    }

    /**
     * Values on-hand stock of a branch at current WAC.
     */
    @Transactional(readOnly = true)
    public InventoryValuation getValuation(UUID branchId) {
        Map<UUID, BigDecimal> wacByItem = new HashMap<>();
        List<ValuationLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (OnHandResult onHand : ledgerService.getOnHandByBranch(branchId, null)) {
            if (onHand.getOnHand().signum() == 0) {
                continue;
            }
            BigDecimal wac = wacByItem.computeIfAbsent(onHand.getItemId(), this::getWac);
            BigDecimal value = onHand.getOnHand().multiply(wac);
            lines.add(new ValuationLine(onHand.getItemId(), onHand.getLocationId(), onHand.getOnHand(), wac, value));
            total = total.add(value);
        }
        return new InventoryValuation(branchId, List.copyOf(lines), total);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private void validate(CreateCostLayerRequest request) {
        if (request.getItemId() == null || request.getLocationId() == null) {
            throw new ValidationException("Item and location are required for a cost layer");
        }
        if (request.getQtyReceived() == null || request.getQtyReceived().signum() <= 0) {
            throw new ValidationException("Cost layer quantity must be positive");
        }
        if (request.getUnitCost() == null || request.getUnitCost().signum() < 0) {
            throw new ValidationException("Cost layer unit cost cannot be negative");
        }
        if (request.getSourceType() == null || request.getSourceId() == null) {
            throw new ValidationException("Cost layer source is required");
        }
    }
}
