package com.flagship.inventory_valuation.costing;

import java.util.List;
import java.util.UUID;

/**
 * Read-only bill of materials for a sellable or producible target.
 */
public interface RecipeProvider {

    /**
     * Ordered ingredient lines for the target, base and modifier lines together.
     * Empty when the target has no recipe.
     */
    List<RecipeIngredient> getIngredients(UUID targetId);
}
