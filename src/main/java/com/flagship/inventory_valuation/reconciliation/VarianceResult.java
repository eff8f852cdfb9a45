package com.flagship.inventory_valuation.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Counted versus expected on-hand for one (item, location), valued at WAC.
 * A positive variance is a gain.
 */
@Value
public class VarianceResult {
    UUID itemId;
    UUID locationId;
    BigDecimal expectedQty;
    BigDecimal countedQty;
    BigDecimal varianceQty;
    BigDecimal wac;
    BigDecimal varianceValue;
    boolean withinTolerance;

    public boolean hasVariance() {
        return varianceQty.signum() != 0;
    }
}
