package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ValuationLine {
    UUID itemId;
    UUID locationId;
    BigDecimal onHand;
    BigDecimal wac;
    BigDecimal totalValue;
}
