package com.flagship.inventory_valuation.movement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Quantity taken out of one (item, location). Always positive.
 */
@Value
public class StockLine {
    UUID itemId;
    UUID locationId;
    BigDecimal qty;

    public static StockLine of(UUID itemId, UUID locationId, BigDecimal qty) {
        return new StockLine(itemId, locationId, qty);
    }
}
