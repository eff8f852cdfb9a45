package com.flagship.inventory_valuation.lot;

import lombok.Value;

/**
 * Result of {@link LotService#createLot}. {@code existing} is true when the same
 * source had already created this lot and nothing new was written.
 */
@Value
public class LotCreation {
    Lot lot;
    boolean existing;
}
