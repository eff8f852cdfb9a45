package com.flagship.inventory_valuation.gl;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Looks up chart-of-accounts labels for previews.
 */
@Component
public class GlAccountDirectory {

    private final JdbcTemplate jdbcTemplate;

    public GlAccountDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<GlAccount> findById(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, org_id, code, name FROM gl_accounts WHERE id = ?",
            (rs, rowNum) -> new GlAccount(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("org_id")),
                rs.getString("code"),
                rs.getString("name")),
            accountId
        ).stream().findFirst();
    }
}
