package com.flagship.inventory_valuation.gl;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Component
public class JdbcFiscalPeriodLookup implements FiscalPeriodLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcFiscalPeriodLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<FiscalPeriod> findPeriod(UUID orgId, LocalDate date) {
        return jdbcTemplate.query(
            "SELECT id, org_id, name, starts_on, ends_on, status FROM fiscal_periods " +
            "WHERE org_id = ? AND starts_on <= ? AND ends_on >= ? " +
            "ORDER BY starts_on DESC LIMIT 1",
            (rs, rowNum) -> new FiscalPeriod(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("org_id")),
                rs.getString("name"),
                rs.getDate("starts_on").toLocalDate(),
                rs.getDate("ends_on").toLocalDate(),
                FiscalPeriodStatus.valueOf(rs.getString("status"))),
            orgId, Date.valueOf(date), Date.valueOf(date)
        ).stream().findFirst();
    }
}
