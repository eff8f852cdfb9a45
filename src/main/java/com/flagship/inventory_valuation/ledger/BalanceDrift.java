package com.flagship.inventory_valuation.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A cached balance row that disagreed with the ledger sum when it was rebuilt.
 */
@Value
public class BalanceDrift {
    UUID branchId;
    UUID itemId;
    UUID locationId;
    BigDecimal cachedOnHand;
    BigDecimal ledgerOnHand;

    public BigDecimal getDifference() {
        return ledgerOnHand.subtract(cachedOnHand);
    }
}
