package com.flagship.inventory_valuation.movement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One received line. A lot is only created when {@code lotNumber} is set.
 */
@Value
@Builder
public class ReceiptLine {
    UUID itemId;
    UUID locationId;
    BigDecimal qty;
    BigDecimal unitCost;
    String lotNumber;
    LocalDate expiryDate;
    LocalDate manufacturingDate;
    String supplierLotRef;
}
