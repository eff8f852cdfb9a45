package com.flagship.inventory_valuation.costing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class JdbcRecipeProvider implements RecipeProvider {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRecipeProvider(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<RecipeIngredient> getIngredients(UUID targetId) {
        return jdbcTemplate.query(
            "SELECT l.item_id, l.qty_per_unit, l.modifier_option_id " +
            "FROM recipe_lines l JOIN recipes r ON r.id = l.recipe_id " +
            "WHERE r.target_id = ? AND r.active = true ORDER BY l.line_order, l.id",
            (rs, rowNum) -> new RecipeIngredient(
                UUID.fromString(rs.getString("item_id")),
                rs.getBigDecimal("qty_per_unit"),
                rs.getString("modifier_option_id") != null
                    ? UUID.fromString(rs.getString("modifier_option_id")) : null),
            targetId);
    }
}
