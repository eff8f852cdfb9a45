package com.flagship.inventory_valuation.audit;

/**
 * Append-only destination for audit events.
 *
 * Fire-and-forget: implementations must never throw into the caller or roll
 * back the caller's transaction.
 */
public interface AuditEventSink {

    void record(AuditEvent event);
}
