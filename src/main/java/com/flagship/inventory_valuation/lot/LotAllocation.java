package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable trace of quantity taken from a lot by a business document.
 */
@Value
public class LotAllocation {
    UUID id;
    UUID lotId;
    UUID ledgerEntryId;
    BigDecimal allocatedQty;
    LedgerSourceType sourceType;
    String sourceId;
    int allocationOrder;
    Instant createdAt;
}
