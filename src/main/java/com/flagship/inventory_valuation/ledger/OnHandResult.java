package com.flagship.inventory_valuation.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * On-hand quantity for one (item, location) in a branch, summed from the ledger.
 */
@Value
public class OnHandResult {
    UUID itemId;
    UUID locationId;
    UUID branchId;
    BigDecimal onHand;
}
