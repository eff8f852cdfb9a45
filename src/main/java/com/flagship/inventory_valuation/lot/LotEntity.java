package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.exception.InsufficientStockException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for an inventory lot.
 *
 * Key design principles:
 * - No setters: quantity and status only change through decrement/increment/hold methods
 * - Status is recomputed from quantity, expiry and the quarantine flag after every change
 * - Rows are inserted by {@link LotService} with ON CONFLICT DO NOTHING so the unique
 *   lot-number key, not a pre-check, decides idempotency
 */
@Entity
@Table(
    name = "inventory_lots",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_inventory_lots_number",
        columnNames = {"org_id", "branch_id", "item_id", "location_id", "lot_number"}),
    indexes = @Index(name = "idx_inventory_lots_fefo", columnList = "item_id, location_id, status, expiry_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LotEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "location_id", nullable = false, updatable = false)
    private UUID locationId;

    @Column(name = "lot_number", nullable = false, updatable = false)
    private String lotNumber;

    @Column(name = "received_qty", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal receivedQty;

    @Column(name = "remaining_qty", nullable = false, precision = 19, scale = 6)
    private BigDecimal remainingQty;

    @Column(name = "unit_cost", precision = 19, scale = 6, updatable = false)
    private BigDecimal unitCost;

    @Column(name = "expiry_date", updatable = false)
    private LocalDate expiryDate;

    @Column(name = "manufacturing_date", updatable = false)
    private LocalDate manufacturingDate;

    @Column(name = "supplier_lot_ref", updatable = false)
    private String supplierLotRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false)
    private LedgerSourceType sourceType;

    @Column(name = "source_id", updatable = false)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LotStatus status;

    @Column(nullable = false)
    private boolean quarantined;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Takes quantity out of the lot. Flips to DEPLETED at zero.
     *
     * @throws InsufficientStockException if qty exceeds the remaining quantity
     */
    void decrement(BigDecimal qty, LocalDate today) {
        requirePositive(qty);
        if (remainingQty.compareTo(qty) < 0) {
            throw new InsufficientStockException(
                String.format("Cannot decrement %s from lot %s - only %s remaining",
                    qty.toPlainString(), lotNumber, remainingQty.toPlainString()),
                remainingQty, qty);
        }
        this.remainingQty = remainingQty.subtract(qty);
        refreshStatus(today);
    }

    /**
     * Returns quantity to the lot, reviving it if it was DEPLETED.
     * The lot can never hold more than it originally received.
     */
    void increment(BigDecimal qty, LocalDate today) {
        requirePositive(qty);
        BigDecimal next = remainingQty.add(qty);
        if (next.compareTo(receivedQty) > 0) {
            throw new ValidationException(
                String.format("Cannot increment lot %s by %s: remaining would exceed received quantity %s",
                    lotNumber, qty.toPlainString(), receivedQty.toPlainString()));
        }
        this.remainingQty = next;
        refreshStatus(today);
    }

    void quarantine() {
        this.quarantined = true;
        this.status = LotStatus.QUARANTINE;
    }

    void release(LocalDate today) {
        if (!quarantined) {
            throw new ValidationException("Lot " + lotNumber + " is not in quarantine");
        }
        this.quarantined = false;
        refreshStatus(today);
    }

    void refreshStatus(LocalDate today) {
        this.status = LotStatus.derive(remainingQty, expiryDate, quarantined, today);
    }

    public Lot toDomain() {
        return new Lot(
            id,
            orgId,
            branchId,
            itemId,
            locationId,
            lotNumber,
            receivedQty,
            remainingQty,
            unitCost,
            expiryDate,
            manufacturingDate,
            supplierLotRef,
            sourceType,
            sourceId,
            status,
            createdAt
        );
    }

    private static void requirePositive(BigDecimal qty) {
        if (qty == null || qty.signum() <= 0) {
            throw new ValidationException("Lot quantity change must be positive");
        }
    }
}
