package com.flagship.inventory_valuation.movement;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Consumption of stock by a sale or production run.
 */
@Value
@Builder
public class DepletionCommand {
    UUID orgId;
    UUID branchId;
    @Builder.Default
    LedgerSourceType sourceType = LedgerSourceType.ORDER;
    String depletionId;
    UUID actorId;
    @Singular
    List<StockLine> lines;
}
