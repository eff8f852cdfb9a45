package com.flagship.inventory_valuation.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Optional filters for the ledger audit trail query. Null fields are ignored.
 */
@Value
@Builder
public class LedgerEntryFilter {
    UUID itemId;
    UUID locationId;
    LedgerEntryReason reason;
    LedgerSourceType sourceType;
    Instant startDate;
    Instant endDate;
    @Builder.Default
    int limit = 100;
    @Builder.Default
    int offset = 0;
}
