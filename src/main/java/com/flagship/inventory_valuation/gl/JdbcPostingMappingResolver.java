package com.flagship.inventory_valuation.gl;

import com.flagship.inventory_valuation.exception.UnconfiguredMappingException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Reads mappings from inventory_posting_mappings. A row with a NULL branch_id is
 * the org default.
 */
@Component
public class JdbcPostingMappingResolver implements PostingMappingResolver {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPostingMappingResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public PostingMapping resolveMapping(UUID orgId, UUID branchId) {
        return jdbcTemplate.query(
            "SELECT org_id, branch_id, inventory_asset_account_id, cogs_account_id, waste_expense_account_id, " +
            "       shrink_expense_account_id, grni_account_id, inventory_gain_account_id " +
            "FROM inventory_posting_mappings " +
            "WHERE org_id = ? AND (branch_id = ? OR branch_id IS NULL) " +
            "ORDER BY branch_id NULLS LAST LIMIT 1",
            (rs, rowNum) -> new PostingMapping(
                uuid(rs, "org_id"),
                uuid(rs, "branch_id"),
                uuid(rs, "inventory_asset_account_id"),
                uuid(rs, "cogs_account_id"),
                uuid(rs, "waste_expense_account_id"),
                uuid(rs, "shrink_expense_account_id"),
                uuid(rs, "grni_account_id"),
                uuid(rs, "inventory_gain_account_id")),
            orgId, branchId
        ).stream().findFirst().orElseThrow(() -> new UnconfiguredMappingException(orgId, branchId));
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }
}
