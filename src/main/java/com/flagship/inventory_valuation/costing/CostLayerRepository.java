package com.flagship.inventory_valuation.costing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the append-only cost layer and layer draw tables.
 *
 * A layer's remaining quantity is never stored. Layers tied to a lot read it
 * from the lot; the others subtract their draws from the received quantity.
 */
@Repository
public class CostLayerRepository {

    private static final String INSERT_COLUMNS =
        "id, org_id, branch_id, item_id, location_id, lot_id, qty_received, unit_cost, prior_wac, new_wac, " +
        "source_type, source_id, notes, created_by, created_at";

    private static final String REMAINING =
        "CASE WHEN c.lot_id IS NULL THEN c.qty_received - COALESCE(d.drawn, 0) ELSE l.remaining_qty END";

    private static final String SELECT_LAYERS =
        "SELECT c.id, c.org_id, c.branch_id, c.item_id, c.location_id, c.lot_id, c.qty_received, " +
        "       " + REMAINING + " AS qty_remaining, c.unit_cost, c.prior_wac, c.new_wac, " +
        "       c.source_type, c.source_id, c.notes, c.created_by, c.created_at " +
        "FROM inventory_cost_layers c " +
        "LEFT JOIN inventory_lots l ON l.id = c.lot_id " +
        "LEFT JOIN (SELECT layer_id, SUM(qty) AS drawn FROM inventory_cost_layer_draws GROUP BY layer_id) d " +
        "       ON d.layer_id = c.id ";

    private static final String TOTALS =
        "SELECT COALESCE(SUM(q.qty_remaining * q.unit_cost), 0) AS total_value, " +
        "       COALESCE(SUM(q.qty_remaining), 0) AS total_qty " +
        "FROM (SELECT c.unit_cost, " + REMAINING + " AS qty_remaining " +
        "      FROM inventory_cost_layers c " +
        "      LEFT JOIN inventory_lots l ON l.id = c.lot_id " +
        "      LEFT JOIN (SELECT layer_id, SUM(qty) AS drawn FROM inventory_cost_layer_draws GROUP BY layer_id) d " +
        "             ON d.layer_id = c.id ";

    private final JdbcTemplate jdbcTemplate;

    public CostLayerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the layer unless one already exists for (org, sourceType, sourceId).
     *
     * @return the inserted layer, or empty when the key was already taken
     */
    public Optional<CostLayer> insertIfAbsent(CostLayer layer) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO inventory_cost_layers (" + INSERT_COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (org_id, source_type, source_id) DO NOTHING",
            layer.getId(),
            layer.getOrgId(),
            layer.getBranchId(),
            layer.getItemId(),
            layer.getLocationId(),
            layer.getLotId(),
            layer.getQtyReceived(),
            layer.getUnitCost(),
            layer.getPriorWac(),
            layer.getNewWac(),
            layer.getSourceType().name(),
            layer.getSourceId(),
            layer.getNotes(),
            layer.getCreatedBy(),
            Timestamp.from(layer.getCreatedAt())
        );
        return inserted == 0 ? Optional.empty() : findById(layer.getId());
    }

    public Optional<CostLayer> findById(UUID layerId) {
        return jdbcTemplate.query(SELECT_LAYERS + "WHERE c.id = ?", rowMapper(), layerId)
            .stream().findFirst();
    }

    public Optional<CostLayer> findBySource(UUID orgId, CostSourceType sourceType, String sourceId) {
        return jdbcTemplate.query(
            SELECT_LAYERS + "WHERE c.org_id = ? AND c.source_type = ? AND c.source_id = ?",
            rowMapper(),
            orgId, sourceType.name(), sourceId
        ).stream().findFirst();
    }

    /**
     * Σ(remaining × unitCost) and Σremaining over the item's layers that still hold stock.
     */
    public CostTotals totalsForItem(UUID itemId) {
        return jdbcTemplate.queryForObject(
            TOTALS + "WHERE c.item_id = ?) q WHERE q.qty_remaining > 0",
            totalsMapper(),
            itemId);
    }

    public CostTotals totalsForItemAtLocation(UUID itemId, UUID locationId) {
        return jdbcTemplate.queryForObject(
            TOTALS + "WHERE c.item_id = ? AND c.location_id = ?) q WHERE q.qty_remaining > 0",
            totalsMapper(),
            itemId, locationId);
    }

    /**
     * Layers of an item, newest first.
     */
    public List<CostLayer> findByItem(UUID orgId, UUID itemId, int limit) {
        return jdbcTemplate.query(
            SELECT_LAYERS + "WHERE c.org_id = ? AND c.item_id = ? ORDER BY c.created_at DESC, c.id LIMIT ?",
            rowMapper(),
            orgId, itemId, limit);
    }

    /**
     * Lot-less layers at a position that still hold stock, oldest first, locked
     * until the drawing transaction ends.
     */
    public List<CostLayer> findOpenUntrackedForUpdate(UUID itemId, UUID locationId) {
        return jdbcTemplate.query(
            SELECT_LAYERS +
            "WHERE c.item_id = ? AND c.location_id = ? AND c.lot_id IS NULL " +
            "  AND c.qty_received - COALESCE(d.drawn, 0) > 0 " +
            "ORDER BY c.created_at, c.id FOR UPDATE OF c",
            rowMapper(),
            itemId, locationId);
    }

    /**
     * Lot-less layers written for the lines of one goods receipt.
     */
    public List<CostLayer> findUntrackedForReceipt(UUID orgId, String receiptId) {
        return jdbcTemplate.query(
            SELECT_LAYERS +
            "WHERE c.org_id = ? AND c.source_type = ? AND starts_with(c.source_id, ?) AND c.lot_id IS NULL " +
            "ORDER BY c.source_id FOR UPDATE OF c",
            rowMapper(),
            orgId, CostSourceType.GOODS_RECEIPT.name(), receiptId + "#");
    }

    /**
     * Records stock leaving (positive qty) or returning to (negative qty) a lot-less layer.
     */
    public void insertDraw(UUID layerId, BigDecimal qty, String sourceType, String sourceId, Instant at) {
        jdbcTemplate.update(
            "INSERT INTO inventory_cost_layer_draws (id, layer_id, qty, source_type, source_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            UUID.randomUUID(), layerId, qty, sourceType, sourceId, Timestamp.from(at));
    }

    /**
     * Net quantity a document still holds per layer, for layers it has not fully returned.
     */
    public Map<UUID, BigDecimal> netDrawsForSource(String sourceType, String sourceId) {
        Map<UUID, BigDecimal> net = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT layer_id, SUM(qty) AS net FROM inventory_cost_layer_draws " +
            "WHERE source_type = ? AND source_id = ? GROUP BY layer_id HAVING SUM(qty) > 0 ORDER BY layer_id",
            (RowCallbackHandler) rs -> net.put(UUID.fromString(rs.getString("layer_id")), rs.getBigDecimal("net")),
            sourceType, sourceId);
        return net;
    }

    private RowMapper<CostTotals> totalsMapper() {
        return (rs, rowNum) -> new CostTotals(rs.getBigDecimal("total_value"), rs.getBigDecimal("total_qty"));
    }

    private RowMapper<CostLayer> rowMapper() {
        return (rs, rowNum) -> new CostLayer(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("org_id")),
            nullableUuid(rs.getString("branch_id")),
            UUID.fromString(rs.getString("item_id")),
            UUID.fromString(rs.getString("location_id")),
            nullableUuid(rs.getString("lot_id")),
            rs.getBigDecimal("qty_received"),
            nullToZero(rs.getBigDecimal("qty_remaining")),
            rs.getBigDecimal("unit_cost"),
            nullToZero(rs.getBigDecimal("prior_wac")),
            nullToZero(rs.getBigDecimal("new_wac")),
            CostSourceType.valueOf(rs.getString("source_type")),
            rs.getString("source_id"),
            rs.getString("notes"),
            nullableUuid(rs.getString("created_by")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static UUID nullableUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
