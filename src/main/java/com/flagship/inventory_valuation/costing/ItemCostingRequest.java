package com.flagship.inventory_valuation.costing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * A sold line to be costed against its recipe.
 */
@Value
@Builder
public class ItemCostingRequest {
    UUID targetId;
    BigDecimal quantity;
    BigDecimal unitPrice;
    @Builder.Default
    BigDecimal modifiersPrice = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal discount = BigDecimal.ZERO;
    @Builder.Default
    List<ModifierSelection> modifiers = List.of();
}
