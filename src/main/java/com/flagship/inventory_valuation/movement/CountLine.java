package com.flagship.inventory_valuation.movement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CountLine {
    UUID itemId;
    UUID locationId;
    BigDecimal countedQty;

    public static CountLine of(UUID itemId, UUID locationId, BigDecimal countedQty) {
        return new CountLine(itemId, locationId, countedQty);
    }
}
