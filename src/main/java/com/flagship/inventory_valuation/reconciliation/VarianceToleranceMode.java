package com.flagship.inventory_valuation.reconciliation;

public enum VarianceToleranceMode {
    /** Variance value may not exceed a fixed amount. */
    ABSOLUTE,
    /** Variance value may not exceed a percentage of the expected stock value. */
    RELATIVE
}
