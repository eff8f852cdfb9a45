package com.flagship.inventory_valuation.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Input for {@link StockLedgerService#recordEntry}.
 *
 * {@code allowNegative} skips the on-hand check; it is only meant for
 * count adjustments and reversals that must land regardless of current stock.
 */
@Value
@Builder
public class RecordEntryRequest {
    UUID itemId;
    UUID locationId;
    BigDecimal qty;
    LedgerEntryReason reason;
    LedgerSourceType sourceType;
    String sourceId;
    String notes;
    UUID createdBy;
    Map<String, Object> metadata;
    boolean allowNegative;
}
