package com.flagship.inventory_valuation.movement;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One row per applied business document.
 *
 * The unique (org_id, kind, source_id) key makes a retried or concurrent
 * submission of the same document wait for the first one and then find it
 * already claimed.
 */
@Repository
@RequiredArgsConstructor
public class MovementDocumentRegistry {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return true when this call claimed the document, false if it was already applied
     */
    public boolean claim(UUID orgId, UUID branchId, MovementKind kind, String sourceId, UUID actorId, Instant at) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO inventory_movement_documents (id, org_id, branch_id, kind, source_id, created_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT (org_id, kind, source_id) DO NOTHING",
            UUID.randomUUID(), orgId, branchId, kind.name(), sourceId, actorId, Timestamp.from(at));
        return inserted == 1;
    }

    public void recordValue(UUID orgId, MovementKind kind, String sourceId, BigDecimal value) {
        jdbcTemplate.update(
            "UPDATE inventory_movement_documents SET amount = ? WHERE org_id = ? AND kind = ? AND source_id = ?",
            value, orgId, kind.name(), sourceId);
    }

    /**
     * Value recorded for a claimed document. Empty when it is unknown or was never valued.
     */
    public Optional<BigDecimal> findValue(UUID orgId, MovementKind kind, String sourceId) {
        List<BigDecimal> values = jdbcTemplate.query(
            "SELECT amount FROM inventory_movement_documents WHERE org_id = ? AND kind = ? AND source_id = ?",
            (rs, rowNum) -> rs.getBigDecimal("amount"),
            orgId, kind.name(), sourceId);
        return values.stream().filter(v -> v != null).findFirst();
    }

    public boolean isApplied(UUID orgId, MovementKind kind, String sourceId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM inventory_movement_documents WHERE org_id = ? AND kind = ? AND source_id = ?",
            Integer.class, orgId, kind.name(), sourceId);
        return count != null && count > 0;
    }
}
