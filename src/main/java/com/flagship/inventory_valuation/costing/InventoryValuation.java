package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * On-hand x WAC for every stocked (item, location) of a branch.
 */
@Value
public class InventoryValuation {
    UUID branchId;
    List<ValuationLine> lines;
    BigDecimal totalValue;
}
