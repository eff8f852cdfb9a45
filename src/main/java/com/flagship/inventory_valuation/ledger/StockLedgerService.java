package com.flagship.inventory_valuation.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.inventory_valuation.exception.InsufficientStockException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only stock movement ledger.
 *
 * This service enforces the core invariants:
 * 1. Ledger entries are never updated or deleted (also enforced by database triggers)
 * 2. On-hand is always SUM(qty) over the ledger, never a separately maintained counter
 * 3. On-hand for an (item, location) never goes negative unless the caller opts out
 *
 * Writers on the same (item, location, branch) serialize on a row lock taken on
 * inventory_stock_balances. That table also holds a cached on-hand that can always
 * be rebuilt from the ledger with {@link #rebuildBalances(UUID)}.
 */
@Service
@Slf4j
public class StockLedgerService {

    private static final String ENTRY_COLUMNS =
        "id, org_id, branch_id, item_id, location_id, qty, reason, source_type, source_id, " +
        "notes, created_at, created_by, metadata, sequence_number";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final InventoryMetrics metrics;
    private final Clock clock;

    public StockLedgerService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, InventoryMetrics metrics,
                              Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records a movement in the ledger.
     *
     * This method:
     * 1. Validates the request
     * 2. Locks the balance row for (item, location, branch), creating it on first use
     * 3. Re-reads current on-hand from the ledger and rejects outbound movements
     *    that would make it negative (unless allowed)
     * 4. Inserts the entry and refreshes the cached balance
     *
     * Joins the caller's transaction when one is active.
     *
     * @return the persisted entry, including its database sequence number
     * @throws ValidationException if the request is malformed
     * @throws InsufficientStockException if the movement would make on-hand negative
     */
    @Transactional
    public LedgerEntry recordEntry(UUID orgId, UUID branchId, RecordEntryRequest request) {
        validate(orgId, branchId, request);
        MDC.put("itemId", request.getItemId().toString());
        try {
            BigDecimal qty = request.getQty();
            log.debug("Recording ledger entry: item={}, location={}, qty={}, reason={}",
                request.getItemId(), request.getLocationId(), qty, request.getReason());

            lockBalance(orgId, branchId, request.getItemId(), request.getLocationId());

            boolean mustCheck = !request.isAllowNegative()
                && !request.getReason().isUnconditionalInbound()
                && qty.signum() < 0;
            if (mustCheck) {
                BigDecimal current = getOnHand(request.getItemId(), request.getLocationId(), branchId);
                if (current.add(qty).signum() < 0) {
                    metrics.recordInsufficientStock();
                    throw new InsufficientStockException(
                        String.format("Insufficient stock: current on-hand is %s, cannot subtract %s",
                            current.toPlainString(), qty.abs().toPlainString()),
                        current, qty.abs());
                }
            }

            LedgerEntry entry = jdbcTemplate.queryForObject(
                "INSERT INTO inventory_ledger_entries " +
                "(id, org_id, branch_id, item_id, location_id, qty, reason, source_type, source_id, " +
                " notes, created_at, created_by, metadata) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb) RETURNING " + ENTRY_COLUMNS,
                ledgerEntryRowMapper(),
                UUID.randomUUID(),
                orgId,
                branchId,
                request.getItemId(),
                request.getLocationId(),
                qty,
                request.getReason().name(),
                request.getSourceType().name(),
                request.getSourceId(),
                request.getNotes(),
                Timestamp.from(Instant.now(clock)),
                request.getCreatedBy(),
                writeMetadata(request.getMetadata())
            );

            jdbcTemplate.update(
                "UPDATE inventory_stock_balances SET on_hand = on_hand + ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE branch_id = ? AND item_id = ? AND location_id = ?",
                qty, branchId, request.getItemId(), request.getLocationId()
            );

            metrics.recordLedgerEntry(request.getReason().name());
            log.info("Ledger entry {} created: item={}, qty={}, reason={}",
                entry.getId(), request.getItemId(), qty, request.getReason());
            return entry;
        } finally {
            MDC.remove("itemId");
        }
    }

    /**
     * Records a manual stock adjustment.
     */
    @Transactional
    public LedgerEntry recordAdjustment(UUID orgId, UUID branchId, UUID itemId, UUID locationId,
                                        BigDecimal qty, UUID createdBy, String sourceId,
                                        String notes, boolean allowNegative) {
        return recordEntry(orgId, branchId, RecordEntryRequest.builder()
            .itemId(itemId)
            .locationId(locationId)
            .qty(qty)
            .reason(LedgerEntryReason.ADJUSTMENT)
            .sourceType(LedgerSourceType.STOCK_ADJUSTMENT)
            .sourceId(sourceId)
            .notes(notes)
            .createdBy(createdBy)
            .allowNegative(allowNegative)
            .build());
    }

    /**
     * Records a count adjustment from a stocktake session.
     * Counting can find less than the system expected, so these may go negative.
     */
    @Transactional
    public LedgerEntry recordCountAdjustment(UUID orgId, UUID branchId, UUID itemId, UUID locationId,
                                             BigDecimal delta, String countSessionId, UUID createdBy) {
        return recordEntry(orgId, branchId, RecordEntryRequest.builder()
            .itemId(itemId)
            .locationId(locationId)
            .qty(delta)
            .reason(LedgerEntryReason.COUNT_ADJUSTMENT)
            .sourceType(LedgerSourceType.COUNT_SESSION)
            .sourceId(countSessionId)
            .notes("Count adjustment from session " + countSessionId)
            .createdBy(createdBy)
            .allowNegative(true)
            .build());
    }

    /**
     * Gets on-hand for an item at a location, computed as SUM(qty) from the ledger.
     */
    public BigDecimal getOnHand(UUID itemId, UUID locationId, UUID branchId) {
        BigDecimal onHand = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(qty), 0) FROM inventory_ledger_entries " +
            "WHERE item_id = ? AND location_id = ? AND branch_id = ?",
            BigDecimal.class,
            itemId, locationId, branchId
        );
        return onHand != null ? onHand : BigDecimal.ZERO;
    }

    /**
     * Gets on-hand for an item at every location of a branch.
     */
    public List<OnHandResult> getOnHandByLocation(UUID itemId, UUID branchId) {
        return jdbcTemplate.query(
            "SELECT item_id, location_id, branch_id, SUM(qty) AS on_hand FROM inventory_ledger_entries " +
            "WHERE item_id = ? AND branch_id = ? GROUP BY item_id, location_id, branch_id ORDER BY location_id",
            onHandRowMapper(),
            itemId, branchId
        );
    }

    /**
     * Gets on-hand for every item in a branch, optionally restricted to one location.
     */
    public List<OnHandResult> getOnHandByBranch(UUID branchId, UUID locationId) {
        if (locationId == null) {
            return jdbcTemplate.query(
                "SELECT item_id, location_id, branch_id, SUM(qty) AS on_hand FROM inventory_ledger_entries " +
                "WHERE branch_id = ? GROUP BY item_id, location_id, branch_id ORDER BY item_id, location_id",
                onHandRowMapper(),
                branchId
            );
        }
        return jdbcTemplate.query(
            "SELECT item_id, location_id, branch_id, SUM(qty) AS on_hand FROM inventory_ledger_entries " +
            "WHERE branch_id = ? AND location_id = ? GROUP BY item_id, location_id, branch_id ORDER BY item_id",
            onHandRowMapper(),
            branchId, locationId
        );
    }

    /**
     * Reads the cached balance. May lag only if someone bypassed this service;
     * use {@link #getOnHand} when correctness matters.
     */
    public BigDecimal getCachedOnHand(UUID itemId, UUID locationId, UUID branchId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT on_hand FROM inventory_stock_balances WHERE branch_id = ? AND item_id = ? AND location_id = ?",
            BigDecimal.class,
            branchId, itemId, locationId
        );
        return rows.isEmpty() ? BigDecimal.ZERO : rows.get(0);
    }

    /**
     * Gets ledger entries for the audit trail, newest first.
     */
    public LedgerEntryPage getLedgerEntries(UUID orgId, UUID branchId, LedgerEntryFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE org_id = ? AND branch_id = ?");
        List<Object> params = new ArrayList<>(List.of(orgId, branchId));

        if (filter.getItemId() != null) {
            where.append(" AND item_id = ?");
            params.add(filter.getItemId());
        }
        if (filter.getLocationId() != null) {
            where.append(" AND location_id = ?");
            params.add(filter.getLocationId());
        }
        if (filter.getReason() != null) {
            where.append(" AND reason = ?");
            params.add(filter.getReason().name());
        }
        if (filter.getSourceType() != null) {
            where.append(" AND source_type = ?");
            params.add(filter.getSourceType().name());
        }
        if (filter.getStartDate() != null) {
            where.append(" AND created_at >= ?");
            params.add(Timestamp.from(filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            where.append(" AND created_at <= ?");
            params.add(Timestamp.from(filter.getEndDate()));
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM inventory_ledger_entries" + where, Long.class, params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(filter.getLimit());
        pageParams.add(filter.getOffset());
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM inventory_ledger_entries" + where +
            " ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(),
            pageParams.toArray());

        return new LedgerEntryPage(entries, total != null ? total : 0L);
    }

    /**
     * Gets all entries written for one business document, oldest first.
     */
    public List<LedgerEntry> getEntriesForSource(UUID orgId, LedgerSourceType sourceType, String sourceId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM inventory_ledger_entries " +
            "WHERE org_id = ? AND source_type = ? AND source_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            orgId, sourceType.name(), sourceId);
    }

    /**
     * Recomputes every cached balance of an org from the ledger.
     *
     * Missing balance rows are created; rows that disagree with SUM(qty) are
     * overwritten and reported.
     *
     * @return the rows that had drifted, with their value before the rebuild
     */
    @Transactional
    public List<BalanceDrift> rebuildBalances(UUID orgId) {
        jdbcTemplate.update(
            "INSERT INTO inventory_stock_balances (org_id, branch_id, item_id, location_id, on_hand, updated_at) " +
            "SELECT org_id, branch_id, item_id, location_id, 0, CURRENT_TIMESTAMP FROM inventory_ledger_entries " +
            "WHERE org_id = ? GROUP BY org_id, branch_id, item_id, location_id " +
            "ON CONFLICT (branch_id, item_id, location_id) DO NOTHING",
            orgId);
        jdbcTemplate.queryForList(
            "SELECT item_id FROM inventory_stock_balances WHERE org_id = ? FOR UPDATE", String.class, orgId);

        List<BalanceDrift> drifts = jdbcTemplate.query(
            "SELECT b.branch_id, b.item_id, b.location_id, b.on_hand AS cached, " +
            "       COALESCE((SELECT SUM(e.qty) FROM inventory_ledger_entries e " +
            "                 WHERE e.branch_id = b.branch_id AND e.item_id = b.item_id " +
            "                   AND e.location_id = b.location_id), 0) AS ledger " +
            "FROM inventory_stock_balances b WHERE b.org_id = ?",
            (rs, rowNum) -> new BalanceDrift(
                UUID.fromString(rs.getString("branch_id")),
                UUID.fromString(rs.getString("item_id")),
                UUID.fromString(rs.getString("location_id")),
                rs.getBigDecimal("cached"),
                rs.getBigDecimal("ledger")),
            orgId
        ).stream().filter(d -> d.getCachedOnHand().compareTo(d.getLedgerOnHand()) != 0).toList();

        for (BalanceDrift drift : drifts) {
            jdbcTemplate.update(
                "UPDATE inventory_stock_balances SET on_hand = ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE branch_id = ? AND item_id = ? AND location_id = ?",
                drift.getLedgerOnHand(), drift.getBranchId(), drift.getItemId(), drift.getLocationId());
            log.warn("Rebuilt drifted balance: item={}, location={}, cached={}, ledger={}",
                drift.getItemId(), drift.getLocationId(), drift.getCachedOnHand(), drift.getLedgerOnHand());
        }
        return drifts;
    }

    private void lockBalance(UUID orgId, UUID branchId, UUID itemId, UUID locationId) {
        jdbcTemplate.update(
            "INSERT INTO inventory_stock_balances (org_id, branch_id, item_id, location_id, on_hand, updated_at) " +
            "VALUES (?, ?, ?, ?, 0, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (branch_id, item_id, location_id) DO NOTHING",
            orgId, branchId, itemId, locationId);
        jdbcTemplate.queryForObject(
            "SELECT on_hand FROM inventory_stock_balances " +
            "WHERE branch_id = ? AND item_id = ? AND location_id = ? FOR UPDATE",
            BigDecimal.class,
            branchId, itemId, locationId);
    }

    private void validate(UUID orgId, UUID branchId, RecordEntryRequest request) {
        Objects.requireNonNull(request, "request");
        if (orgId == null || branchId == null) {
            throw new ValidationException("Org and branch are required");
        }
        if (request.getItemId() == null || request.getLocationId() == null) {
            throw new ValidationException("Item and location are required");
        }
        if (request.getQty() == null || request.getQty().signum() == 0) {
            throw new ValidationException("Ledger quantity must be non-zero");
        }
        if (request.getReason() == null || request.getSourceType() == null) {
            throw new ValidationException("Reason and source type are required");
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Ledger metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger metadata: " + json, e);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("org_id")),
            UUID.fromString(rs.getString("branch_id")),
            UUID.fromString(rs.getString("item_id")),
            UUID.fromString(rs.getString("location_id")),
            rs.getBigDecimal("qty"),
            LedgerEntryReason.valueOf(rs.getString("reason")),
            LedgerSourceType.valueOf(rs.getString("source_type")),
            rs.getString("source_id"),
            rs.getString("notes"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getString("created_by") != null ? UUID.fromString(rs.getString("created_by")) : null,
            readMetadata(rs.getString("metadata")),
            rs.getLong("sequence_number")
        );
    }

    private RowMapper<OnHandResult> onHandRowMapper() {
        return (rs, rowNum) -> new OnHandResult(
            UUID.fromString(rs.getString("item_id")),
            UUID.fromString(rs.getString("location_id")),
            UUID.fromString(rs.getString("branch_id")),
            rs.getBigDecimal("on_hand")
        );
    }
}
