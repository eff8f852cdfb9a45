package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable trace of quantity returned to a lot (voids, transfer receipts).
 */
@Value
public class LotIncrement {
    UUID id;
    UUID lotId;
    BigDecimal qty;
    LedgerSourceType sourceType;
    String sourceId;
    UUID createdBy;
    Instant createdAt;
}
