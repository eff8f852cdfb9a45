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
 * Trace row for quantity returned to a lot. Together with the allocation rows
 * it lets the lot's remaining quantity be re-derived from stored history.
 */
@Entity
@Table(name = "inventory_lot_increments", indexes = @Index(name = "idx_lot_increments_lot", columnList = "lot_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LotIncrementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "lot_id", nullable = false, updatable = false)
    private UUID lotId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal qty;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", updatable = false)
    private LedgerSourceType sourceType;

    @Column(name = "source_id", updatable = false)
    private String sourceId;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LotIncrementEntity create(LotEntity lot, BigDecimal qty, LedgerSourceType sourceType,
                                     String sourceId, UUID createdBy) {
        return new LotIncrementEntity(
            UUID.randomUUID(),
            lot.getOrgId(),
            lot.getId(),
            qty,
            sourceType,
            sourceId,
            createdBy,
            Instant.now()
        );
    }

    public LotIncrement toDomain() {
        return new LotIncrement(id, lotId, qty, sourceType, sourceId, createdBy, createdAt);
    }
}
