package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Cost and margin of a sold line.
 *
 * marginPct is exactly zero when the line's net revenue is zero.
 */
@Value
public class ItemCosting {
    BigDecimal costUnit;
    BigDecimal costTotal;
    BigDecimal lineNet;
    BigDecimal marginTotal;
    BigDecimal marginPct;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static ItemCosting of(BigDecimal costUnit, BigDecimal quantity, BigDecimal unitPrice,
                                 BigDecimal modifiersPrice, BigDecimal discount) {
        BigDecimal costTotal = costUnit.multiply(quantity);
        BigDecimal lineNet = unitPrice.multiply(quantity).add(modifiersPrice).subtract(discount);
        BigDecimal marginTotal = lineNet.subtract(costTotal);
        BigDecimal marginPct = lineNet.signum() == 0
            ? BigDecimal.ZERO
            : marginTotal.divide(lineNet, WeightedAverageCost.PRECISION).multiply(HUNDRED);
        return new ItemCosting(costUnit, costTotal, lineNet, marginTotal, marginPct);
    }
}
