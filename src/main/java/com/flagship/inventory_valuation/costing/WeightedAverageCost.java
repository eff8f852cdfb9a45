package com.flagship.inventory_valuation.costing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Weighted-average cost arithmetic.
 *
 * Internal results keep 34 significant digits. Rounding to currency happens
 * only in {@link #toDisplay}.
 */
public final class WeightedAverageCost {

    static final MathContext PRECISION = MathContext.DECIMAL128;
    private static final int DISPLAY_SCALE = 2;

    private WeightedAverageCost() {
    }

    /**
     * WAC over the layers with quantity still on hand, weighted by that
     * remaining quantity. Zero when no layer has any left.
     */
    public static BigDecimal compute(Collection<CostLayer> layers) {
        CostTotals totals = CostTotals.EMPTY;
        for (CostLayer layer : layers) {
            if (layer.getQtyRemaining().signum() > 0) {
                totals = totals.plus(layer.getQtyRemaining(), layer.getUnitCost());
            }
        }
        return totals.wac();
    }

    public static BigDecimal of(BigDecimal totalValue, BigDecimal totalQty) {
        if (totalQty == null || totalQty.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return totalValue.divide(totalQty, PRECISION);
    }

    public static BigDecimal toDisplay(BigDecimal amount) {
        return amount.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }
}
