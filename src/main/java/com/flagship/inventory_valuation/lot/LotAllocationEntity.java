package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Trace row written in the same transaction as every lot decrement.
 * Append-only: the table rejects UPDATE and DELETE.
 */
@Entity
@Table(
    name = "inventory_lot_allocations",
    indexes = {
        @Index(name = "idx_lot_allocations_lot", columnList = "lot_id"),
        @Index(name = "idx_lot_allocations_source", columnList = "source_type, source_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LotAllocationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "lot_id", nullable = false, updatable = false)
    private UUID lotId;

    @Column(name = "ledger_entry_id", updatable = false)
    private UUID ledgerEntryId;

    @Column(name = "allocated_qty", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal allocatedQty;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false)
    private LedgerSourceType sourceType;

    @Column(name = "source_id", nullable = false, updatable = false)
    private String sourceId;

    @Column(name = "allocation_order", nullable = false, updatable = false)
    private int allocationOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LotAllocationEntity create(LotEntity lot, BigDecimal qty, LedgerSourceType sourceType,
                                      String sourceId, int allocationOrder, UUID ledgerEntryId) {
        return new LotAllocationEntity(
            UUID.randomUUID(),
            lot.getOrgId(),
            lot.getId(),
            ledgerEntryId,
            qty,
            sourceType,
            sourceId,
            allocationOrder,
            Instant.now()
        );
    }

    public LotAllocation toDomain() {
        return new LotAllocation(id, lotId, ledgerEntryId, allocatedQty, sourceType, sourceId,
            allocationOrder, createdAt);
    }
}
