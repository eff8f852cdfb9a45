package com.flagship.inventory_valuation.lot;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a FEFO computation. Nothing has been decremented yet.
 *
 * totalAllocated + shortfall always equals the quantity requested.
 */
@Value
public class AllocationPlan {
    List<FefoAllocation> allocations;
    BigDecimal totalAllocated;
    BigDecimal shortfall;

    public boolean isFullyAllocated() {
        return shortfall.signum() == 0;
    }
}
