package com.flagship.inventory_valuation.lot;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One step of a FEFO plan: take {@code allocatedQty} from the lot.
 */
@Value
public class FefoAllocation {
    UUID lotId;
    String lotNumber;
    BigDecimal allocatedQty;
    LocalDate expiryDate;
    int allocationOrder;
}
