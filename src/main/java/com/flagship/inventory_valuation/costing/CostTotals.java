package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * SUM(qty x unitCost) and SUM(qty) over a set of cost layers.
 */
@Value
public class CostTotals {
    public static final CostTotals EMPTY = new CostTotals(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal totalValue;
    BigDecimal totalQty;

    public CostTotals plus(BigDecimal qty, BigDecimal unitCost) {
        return new CostTotals(totalValue.add(qty.multiply(unitCost)), totalQty.add(qty));
    }

    public BigDecimal wac() {
        return WeightedAverageCost.of(totalValue, totalQty);
    }
}
