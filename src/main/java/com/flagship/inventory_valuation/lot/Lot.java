package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Snapshot of a lot (batch) of one item at one location.
 *
 * Invariant: 0 <= remainingQty <= receivedQty.
 */
@Value
public class Lot {
    UUID id;
    UUID orgId;
    UUID branchId;
    UUID itemId;
    UUID locationId;
    String lotNumber;
    BigDecimal receivedQty;
    BigDecimal remainingQty;
    BigDecimal unitCost;
    LocalDate expiryDate;
    LocalDate manufacturingDate;
    String supplierLotRef;
    LedgerSourceType sourceType;
    String sourceId;
    LotStatus status;
    Instant createdAt;

    public boolean hasExpiry() {
        return expiryDate != null;
    }

    /**
     * Days until expiry, negative once expired, null when the lot never expires.
     */
    public Long daysToExpiry(LocalDate today) {
        return expiryDate != null ? ChronoUnit.DAYS.between(today, expiryDate) : null;
    }

    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }

    public boolean isExpiringSoon(LocalDate today, int thresholdDays) {
        Long days = daysToExpiry(today);
        return days != null && days >= 0 && days <= thresholdDays;
    }
}
