package com.flagship.inventory_valuation.audit;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Something the core did that should be recorded in the audit trail.
 */
@Value
@Builder
public class AuditEvent {
    UUID orgId;
    UUID branchId;
    UUID actorId;
    String action;
    String resourceType;
    UUID resourceId;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
