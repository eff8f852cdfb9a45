package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateLotRequest {
    UUID orgId;
    UUID branchId;
    UUID itemId;
    UUID locationId;
    String lotNumber;
    BigDecimal receivedQty;
    BigDecimal unitCost;
    LocalDate expiryDate;
    LocalDate manufacturingDate;
    String supplierLotRef;
    LedgerSourceType sourceType;
    String sourceId;
    String notes;
    UUID createdBy;
}
