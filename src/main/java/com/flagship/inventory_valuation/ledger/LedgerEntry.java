package com.flagship.inventory_valuation.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One signed quantity movement for an (item, location, branch).
 *
 * Write-once: corrections are recorded as new opposing entries.
 * On-hand is always the sum of qty over these rows.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID orgId;
    UUID branchId;
    UUID itemId;
    UUID locationId;
    BigDecimal qty;
    LedgerEntryReason reason;
    LedgerSourceType sourceType;
    String sourceId;
    String notes;
    Instant createdAt;
    UUID createdBy;
    Map<String, Object> metadata;
    Long sequenceNumber;
}
