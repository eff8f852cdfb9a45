package com.flagship.inventory_valuation.lot;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a decrement or increment: the lot as committed plus the id of the
 * trace row written alongside it.
 */
@Value
public class LotMutation {
    Lot lot;
    UUID traceId;
    BigDecimal qty;
}
