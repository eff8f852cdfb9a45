package com.flagship.inventory_valuation.costing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ItemCostingTest {

    @Test
    @DisplayName("Margin is net revenue minus cost, as a percentage of net revenue")
    void marginOfSoldLine() {
        // 2 x 10.00 + 1.00 modifiers - 1.00 discount = 20.00 net; cost 2 x 4.00 = 8.00
        ItemCosting costing = ItemCosting.of(new BigDecimal("4.00"), new BigDecimal("2"),
            new BigDecimal("10.00"), new BigDecimal("1.00"), new BigDecimal("1.00"));

        assertEquals(0, new BigDecimal("8.00").compareTo(costing.getCostTotal()));
        assertEquals(0, new BigDecimal("20.00").compareTo(costing.getLineNet()));
        assertEquals(0, new BigDecimal("12.00").compareTo(costing.getMarginTotal()));
        assertEquals(0, new BigDecimal("60").compareTo(costing.getMarginPct()));
    }

    @Test
    @DisplayName("Zero net revenue gives exactly zero margin percent")
    void zeroNetRevenue() {
        ItemCosting costing = ItemCosting.of(new BigDecimal("3.50"), BigDecimal.ONE,
            new BigDecimal("5.00"), BigDecimal.ZERO, new BigDecimal("5.00"));

        assertEquals(0, BigDecimal.ZERO.compareTo(costing.getLineNet()));
        assertEquals(0, BigDecimal.ZERO.compareTo(costing.getMarginPct()));
        assertEquals(0, new BigDecimal("-3.50").compareTo(costing.getMarginTotal()));
    }
}
