package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.exception.ConflictException;
import com.flagship.inventory_valuation.exception.NotFoundException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Lot (batch) tracking with FEFO allocation.
 *
 * Invariants kept here:
 * 1. 0 <= remainingQty <= receivedQty for every lot (also a table CHECK)
 * 2. Every decrement writes its allocation row in the same transaction
 * 3. remainingQty + SUM(allocated) - SUM(incremented) = receivedQty
 *
 * Lot number uniqueness is decided by the database key, so two concurrent
 * receipts of the same lot cannot both create it.
 */
@Service
@Slf4j
public class LotService {

    private final LotRepository lotRepository;
    private final LotAllocationRepository allocationRepository;
    private final LotIncrementRepository incrementRepository;
    private final FefoAllocator fefoAllocator;
    private final JdbcTemplate jdbcTemplate;
    private final InventoryMetrics metrics;
    private final Clock clock;

    @Value("${inventory.lots.expiring-soon-days:30}")
    private int expiringSoonDays;

    public LotService(LotRepository lotRepository,
                      LotAllocationRepository allocationRepository,
                      LotIncrementRepository incrementRepository,
                      FefoAllocator fefoAllocator,
                      JdbcTemplate jdbcTemplate,
                      InventoryMetrics metrics,
                      Clock clock) {
        this.lotRepository = lotRepository;
        this.allocationRepository = allocationRepository;
        this.incrementRepository = incrementRepository;
        this.fefoAllocator = fefoAllocator;
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates a lot, or returns the existing one when the same source already created it.
     *
     * @throws ConflictException if the lot number is already used by a different source
     */
    @Transactional
    public LotCreation createLot(CreateLotRequest request) {
        validate(request);
        LocalDate today = LocalDate.now(clock);
        UUID id = UUID.randomUUID();
        Instant now = Instant.now(clock);
        LotStatus status = LotStatus.derive(request.getReceivedQty(), request.getExpiryDate(), false, today);

        int inserted = jdbcTemplate.update(
            "INSERT INTO inventory_lots " +
            "(id, org_id, branch_id, item_id, location_id, lot_number, received_qty, remaining_qty, " +
            " unit_cost, expiry_date, manufacturing_date, supplier_lot_ref, source_type, source_id, " +
            " status, quarantined, notes, created_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, false, ?, ?, ?, ?) " +
            "ON CONFLICT (org_id, branch_id, item_id, location_id, lot_number) DO NOTHING",
            id,
            request.getOrgId(),
            request.getBranchId(),
            request.getItemId(),
            request.getLocationId(),
            request.getLotNumber(),
            request.getReceivedQty(),
            request.getReceivedQty(),
            request.getUnitCost(),
            request.getExpiryDate() != null ? Date.valueOf(request.getExpiryDate()) : null,
            request.getManufacturingDate() != null ? Date.valueOf(request.getManufacturingDate()) : null,
            request.getSupplierLotRef(),
            request.getSourceType().name(),
            request.getSourceId(),
            status.name(),
            request.getNotes(),
            request.getCreatedBy(),
            Timestamp.from(now),
            Timestamp.from(now)
        );

        LotEntity lot = lotRepository.findByOrgIdAndBranchIdAndItemIdAndLocationIdAndLotNumber(
                request.getOrgId(), request.getBranchId(), request.getItemId(),
                request.getLocationId(), request.getLotNumber())
            .orElseThrow(() -> new IllegalStateException("Lot vanished after insert: " + request.getLotNumber()));

        if (inserted == 0) {
            boolean sameSource = lot.getSourceType() == request.getSourceType()
                && Objects.equals(lot.getSourceId(), request.getSourceId());
            if (!sameSource) {
                throw new ConflictException(String.format(
                    "Lot number %s already exists for this item and location (source %s %s)",
                    request.getLotNumber(), lot.getSourceType(), lot.getSourceId()));
            }
            log.debug("Lot {} already created by {} {}, returning existing",
                request.getLotNumber(), request.getSourceType(), request.getSourceId());
            return new LotCreation(lot.toDomain(), true);
        }

        metrics.recordLotCreated();
        log.info("Lot {} created: number={}, item={}, qty={}, expiry={}",
            lot.getId(), lot.getLotNumber(), lot.getItemId(), lot.getReceivedQty(), lot.getExpiryDate());
        return new LotCreation(lot.toDomain(), false);
    }

    @Transactional(readOnly = true)
    public Lot getLot(UUID lotId) {
        return loadLot(lotId).toDomain();
    }

    /**
     * Lists lots, newest first. EXPIRED and DEPLETED lots are left out unless
     * the filter asks for them or names those statuses explicitly.
     */
    @Transactional(readOnly = true)
    public List<Lot> listLots(LotFilter filter) {
        Specification<LotEntity> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("orgId"), filter.getOrgId()));
            if (filter.getBranchId() != null) {
                predicates.add(cb.equal(root.get("branchId"), filter.getBranchId()));
            }
            if (filter.getItemId() != null) {
                predicates.add(cb.equal(root.get("itemId"), filter.getItemId()));
            }
            if (filter.getLocationId() != null) {
                predicates.add(cb.equal(root.get("locationId"), filter.getLocationId()));
            }
            if (filter.getStatuses() != null && !filter.getStatuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.getStatuses()));
            } else {
                if (!filter.isIncludeExpired()) {
                    predicates.add(cb.notEqual(root.get("status"), LotStatus.EXPIRED));
                }
                if (!filter.isIncludeDepleted()) {
                    predicates.add(cb.notEqual(root.get("status"), LotStatus.DEPLETED));
                }
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };

        int page = filter.getLimit() > 0 ? filter.getOffset() / filter.getLimit() : 0;
        return lotRepository.findAll(spec,
                PageRequest.of(page, Math.max(filter.getLimit(), 1), Sort.by(Sort.Direction.DESC, "createdAt")))
            .stream()
            .map(LotEntity::toDomain)
            .toList();
    }

    /**
     * Active lots expiring within the configured window, soonest first.
     */
    @Transactional(readOnly = true)
    public List<Lot> getExpiringSoon(UUID orgId, UUID branchId) {
        return getExpiringSoon(orgId, branchId, expiringSoonDays);
    }

    @Transactional(readOnly = true)
    public List<Lot> getExpiringSoon(UUID orgId, UUID branchId, int days) {
        LocalDate today = LocalDate.now(clock);
        LocalDate until = today.plusDays(days);
        List<LotEntity> lots = branchId != null
            ? lotRepository.findExpiringBetweenInBranch(orgId, branchId, today, until)
            : lotRepository.findExpiringBetween(orgId, today, until);
        return lots.stream().map(LotEntity::toDomain).toList();
    }

    /**
     * Computes a FEFO allocation plan. Does not change any lot.
     */
    @Transactional(readOnly = true)
    public AllocationPlan allocateFEFO(UUID orgId, UUID branchId, UUID itemId, UUID locationId,
                                       BigDecimal qtyNeeded, boolean excludeExpired) {
        List<Lot> candidates = lotRepository.findAllocatable(orgId, branchId, itemId, locationId)
            .stream()
            .map(LotEntity::toDomain)
            .toList();
        AllocationPlan plan = fefoAllocator.plan(candidates, qtyNeeded, excludeExpired, LocalDate.now(clock));
        if (!plan.isFullyAllocated()) {
            log.debug("FEFO shortfall for item={}, location={}: needed={}, shortfall={}",
                itemId, locationId, qtyNeeded, plan.getShortfall());
        }
        return plan;
    }

    @Transactional(readOnly = true)
    public AllocationPlan allocateFEFO(UUID orgId, UUID branchId, UUID itemId, UUID locationId,
                                       BigDecimal qtyNeeded) {
        return allocateFEFO(orgId, branchId, itemId, locationId, qtyNeeded, true);
    }

    /**
     * Takes quantity out of a lot and records the allocation trace in one transaction.
     *
     * @throws com.flagship.inventory_valuation.exception.InsufficientStockException
     *         if qty exceeds the lot's remaining quantity
     */
    @Transactional
    public LotMutation decrementLot(UUID lotId, BigDecimal qty, LedgerSourceType sourceType,
                                    String sourceId, int allocationOrder, UUID ledgerEntryId) {
        if (sourceType == null || sourceId == null) {
            throw new ValidationException("Allocation source is required");
        }
        MDC.put("lotId", lotId.toString());
        try {
            LotEntity lot = lotRepository.findByIdForUpdate(lotId)
                .orElseThrow(() -> new NotFoundException("Lot not found: " + lotId));

            lot.decrement(qty, LocalDate.now(clock));
            LotAllocationEntity allocation = allocationRepository.save(
                LotAllocationEntity.create(lot, qty, sourceType, sourceId, allocationOrder, ledgerEntryId));
            lotRepository.save(lot);

            metrics.recordLotAllocation(lot.getStatus() == LotStatus.DEPLETED);
            log.info("Lot {} decremented by {} for {} {}: remaining={}, status={}",
                lot.getLotNumber(), qty, sourceType, sourceId, lot.getRemainingQty(), lot.getStatus());
            return new LotMutation(lot.toDomain(), allocation.getId(), qty);
        } finally {
            MDC.remove("lotId");
        }
    }

    @Transactional
    public LotMutation decrementLot(UUID lotId, BigDecimal qty, LedgerSourceType sourceType,
                                    String sourceId, int allocationOrder) {
        return decrementLot(lotId, qty, sourceType, sourceId, allocationOrder, null);
    }

    /**
     * Decrements every lot named in a plan, in plan order.
     */
    @Transactional
    public List<LotMutation> applyAllocation(AllocationPlan plan, LedgerSourceType sourceType,
                                             String sourceId, UUID ledgerEntryId) {
        List<LotMutation> mutations = new ArrayList<>(plan.getAllocations().size());
        for (FefoAllocation allocation : plan.getAllocations()) {
            mutations.add(decrementLot(allocation.getLotId(), allocation.getAllocatedQty(),
                sourceType, sourceId, allocation.getAllocationOrder(), ledgerEntryId));
        }
        return mutations;
    }

    /**
     * Returns quantity to a lot (void of a consumption, transfer receipt).
     * A DEPLETED lot becomes ACTIVE again.
     */
    @Transactional
    public LotMutation incrementLot(UUID lotId, BigDecimal qty, LedgerSourceType sourceType,
                                    String sourceId, UUID createdBy) {
        MDC.put("lotId", lotId.toString());
        try {
            LotEntity lot = lotRepository.findByIdForUpdate(lotId)
                .orElseThrow(() -> new NotFoundException("Lot not found: " + lotId));

            LotStatus before = lot.getStatus();
            lot.increment(qty, LocalDate.now(clock));
            LotIncrementEntity increment = incrementRepository.save(
                LotIncrementEntity.create(lot, qty, sourceType, sourceId, createdBy));
            lotRepository.save(lot);

            metrics.recordLotIncrement();
            log.info("Lot {} incremented by {}: remaining={}, status {} -> {}",
                lot.getLotNumber(), qty, lot.getRemainingQty(), before, lot.getStatus());
            return new LotMutation(lot.toDomain(), increment.getId(), qty);
        } finally {
            MDC.remove("lotId");
        }
    }

    @Transactional
    public LotMutation incrementLot(UUID lotId, BigDecimal qty) {
        return incrementLot(lotId, qty, null, null, null);
    }

    /**
     * Lots created by a receiving document, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Lot> getLotsForSource(UUID orgId, LedgerSourceType sourceType, String sourceId) {
        return lotRepository.findByOrgIdAndSourceTypeAndSourceIdOrderByCreatedAtAsc(orgId, sourceType, sourceId)
            .stream()
            .map(LotEntity::toDomain)
            .toList();
    }

    /**
     * Rebuilds the consumption history of a lot from its trace rows.
     */
    @Transactional(readOnly = true)
    public LotTraceability getTraceability(UUID lotId) {
        Lot lot = loadLot(lotId).toDomain();
        List<LotAllocation> allocations = allocationRepository
            .findByLotIdOrderByCreatedAtAscAllocationOrderAsc(lotId)
            .stream().map(LotAllocationEntity::toDomain).toList();
        List<LotIncrement> increments = incrementRepository.findByLotIdOrderByCreatedAtAsc(lotId)
            .stream().map(LotIncrementEntity::toDomain).toList();

        BigDecimal totalAllocated = BigDecimal.ZERO;
        Map<LedgerSourceType, BigDecimal> bySource = new EnumMap<>(LedgerSourceType.class);
        for (LotAllocation allocation : allocations) {
            totalAllocated = totalAllocated.add(allocation.getAllocatedQty());
            bySource.merge(allocation.getSourceType(), allocation.getAllocatedQty(), BigDecimal::add);
        }
        BigDecimal totalIncremented = increments.stream()
            .map(LotIncrement::getQty)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        LotTraceability trace = new LotTraceability(lot, allocations, increments,
            totalAllocated, totalIncremented, Map.copyOf(bySource));
        if (!trace.isBalanced()) {
            log.error("Lot {} out of balance: received={}, remaining={}, allocated={}, incremented={}",
                lot.getLotNumber(), lot.getReceivedQty(), lot.getRemainingQty(), totalAllocated, totalIncremented);
        }
        return trace;
    }

    /**
     * Allocations made for one business document, in allocation order.
     */
    @Transactional(readOnly = true)
    public List<LotAllocation> getAllocationsForSource(LedgerSourceType sourceType, String sourceId) {
        return allocationRepository.findBySourceTypeAndSourceIdOrderByAllocationOrderAsc(sourceType, sourceId)
            .stream()
            .map(LotAllocationEntity::toDomain)
            .toList();
    }

    @Transactional
    public Lot quarantineLot(UUID lotId, String reason) {
        LotEntity lot = lotRepository.findByIdForUpdate(lotId)
            .orElseThrow(() -> new NotFoundException("Lot not found: " + lotId));
        lot.quarantine();
        lotRepository.save(lot);
        log.info("Lot {} quarantined: {}", lot.getLotNumber(), reason);
        return lot.toDomain();
    }

    @Transactional
    public Lot releaseLot(UUID lotId) {
        LotEntity lot = lotRepository.findByIdForUpdate(lotId)
            .orElseThrow(() -> new NotFoundException("Lot not found: " + lotId));
        lot.release(LocalDate.now(clock));
        lotRepository.save(lot);
        log.info("Lot {} released from quarantine: status={}", lot.getLotNumber(), lot.getStatus());
        return lot.toDomain();
    }

    /**
     * Flips ACTIVE lots whose expiry has passed to EXPIRED.
     *
     * @param orgId restrict to one org, or null for all
     * @return number of lots changed
     */
    @Transactional
    public int markExpiredLots(UUID orgId) {
        LocalDate today = LocalDate.now(clock);
        int count = orgId != null
            ? lotRepository.markExpiredForOrg(orgId, today)
            : lotRepository.markExpired(today);
        if (count > 0) {
            metrics.recordLotsExpired(count);
            log.info("Marked {} lots as expired", count);
        }
        return count;
    }

    private LotEntity loadLot(UUID lotId) {
        return lotRepository.findById(lotId)
            .orElseThrow(() -> new NotFoundException("Lot not found: " + lotId));
    }

    private void validate(CreateLotRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getOrgId() == null || request.getBranchId() == null
            || request.getItemId() == null || request.getLocationId() == null) {
            throw new ValidationException("Org, branch, item and location are required");
        }
        if (request.getLotNumber() == null || request.getLotNumber().isBlank()) {
            throw new ValidationException("Lot number is required");
        }
        if (request.getReceivedQty() == null || request.getReceivedQty().signum() <= 0) {
            throw new ValidationException("Received quantity must be positive");
        }
        if (request.getUnitCost() != null && request.getUnitCost().signum() < 0) {
            throw new ValidationException("Unit cost cannot be negative");
        }
        if (request.getSourceType() == null) {
            throw new ValidationException("Lot source type is required");
        }
        if (request.getExpiryDate() != null && request.getManufacturingDate() != null
            && request.getExpiryDate().isBefore(request.getManufacturingDate())) {
            throw new ValidationException("Expiry date cannot be before manufacturing date");
        }
    }
}
