package com.flagship.inventory_valuation.lot;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Lot status. Never set directly: always derived from remaining quantity,
 * expiry and the quarantine hold via {@link #derive}.
 */
public enum LotStatus {
    /**
     * Has stock, not expired, not on hold. Only ACTIVE lots are allocatable.
     */
    ACTIVE,

    /**
     * Held back from allocation until released.
     */
    QUARANTINE,

    /**
     * Expiry date has passed while stock remains.
     */
    EXPIRED,

    /**
     * No remaining quantity. Revived by an increment.
     */
    DEPLETED;

    public static LotStatus derive(BigDecimal remainingQty, LocalDate expiryDate,
                                   boolean quarantined, LocalDate today) {
        if (quarantined) {
            return QUARANTINE;
        }
        if (remainingQty.signum() <= 0) {
            return DEPLETED;
        }
        if (expiryDate != null && expiryDate.isBefore(today)) {
            return EXPIRED;
        }
        return ACTIVE;
    }
}
