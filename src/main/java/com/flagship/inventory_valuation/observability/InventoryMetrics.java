package com.flagship.inventory_valuation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for the inventory core.
 *
 * Metrics exposed:
 * - inventory.ledger.entries: ledger rows written, by reason
 * - inventory.lots.created / inventory.lots.allocations / inventory.lots.increments
 * - inventory.lots.expired: lots flipped to EXPIRED by the sweep
 * - inventory.gl.postings: GL posting outcomes, by document type and status
 * - inventory.gl.reversals: reversal journals written, by document type
 * - inventory.gl.idempotency: repeat postings detected, by the layer that caught them
 * - inventory.movement.latency: end-to-end movement operation time
 * - inventory.outbox.relayed: outbox relay attempts, by event type and outcome
 */
@Component
public class InventoryMetrics {

    private final MeterRegistry registry;

    private final Counter lotsCreated;
    private final Counter lotIncrements;
    private final Counter insufficientStock;

    public InventoryMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.lotsCreated = Counter.builder("inventory.lots.created")
                .description("Number of lots created")
                .register(registry);

        this.lotIncrements = Counter.builder("inventory.lots.increments")
                .description("Number of quantity returns to lots")
                .register(registry);

        this.insufficientStock = Counter.builder("inventory.insufficient_stock")
                .description("Movements rejected because stock would go negative")
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordLedgerEntry(String reason) {
        registry.counter("inventory.ledger.entries", "reason", sanitizeTag(reason)).increment();
    }

    public void recordInsufficientStock() {
        insufficientStock.increment();
    }

    /**
     * Records cached balances found out of line with the ledger.
     */
    public void recordBalanceDrift(int driftedRows) {
        registry.counter("inventory.ledger.balance_drift").increment(driftedRows);
    }

    // ==================== Lots ====================

    public void recordLotCreated() {
        lotsCreated.increment();
    }

    public void recordLotAllocation(boolean depleted) {
        registry.counter("inventory.lots.allocations", "depleted", String.valueOf(depleted)).increment();
    }

    public void recordLotIncrement() {
        lotIncrements.increment();
    }

    public void recordLotsExpired(int count) {
        registry.counter("inventory.lots.expired").increment(count);
    }

    // ==================== GL ====================

    public void recordGlPosting(String documentType, String status) {
        registry.counter("inventory.gl.postings",
                "document_type", sanitizeTag(documentType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordGlReversal(String documentType) {
        registry.counter("inventory.gl.reversals", "document_type", sanitizeTag(documentType)).increment();
    }

    /**
     * Records a repeat posting, tagged with what caught it: redis, database or constraint.
     */
    public void recordGlIdempotencyHit(String layer) {
        registry.counter("inventory.gl.idempotency", "result", "hit", "layer", sanitizeTag(layer)).increment();
    }

    // ==================== Movements ====================

    public void recordMovementLatency(String operation, long durationMs) {
        registry.timer("inventory.movement.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Audit / outbox ====================

    /**
     * @param outcome success, failure or dead_letter
     */
    public void recordOutboxRelay(String eventType, String outcome) {
        registry.counter("inventory.outbox.relayed",
                "event_type", sanitizeTag(eventType),
                "outcome", outcome
        ).increment();
    }

    public void recordAuditFailure(String action) {
        registry.counter("inventory.audit.failures", "action", sanitizeTag(action)).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
