package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Full consumption history of a lot, rebuilt from its trace rows.
 */
@Value
public class LotTraceability {
    Lot lot;
    List<LotAllocation> allocations;
    List<LotIncrement> increments;
    BigDecimal totalAllocated;
    BigDecimal totalIncremented;
    Map<LedgerSourceType, BigDecimal> allocatedBySourceType;

    /**
     * Accounting identity: remaining + allocated - incremented = received.
     */
    public boolean isBalanced() {
        return lot.getRemainingQty()
            .add(totalAllocated)
            .subtract(totalIncremented)
            .compareTo(lot.getReceivedQty()) == 0;
    }
}
