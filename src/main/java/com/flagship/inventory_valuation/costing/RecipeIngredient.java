package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of a recipe: how much of an inventory item one unit of the target uses.
 * Lines with a {@code modifierOptionId} only apply when that modifier is selected.
 */
@Value
public class RecipeIngredient {
    UUID itemId;
    BigDecimal qtyPerUnit;
    UUID modifierOptionId;

    public boolean isBase() {
        return modifierOptionId == null;
    }
}
