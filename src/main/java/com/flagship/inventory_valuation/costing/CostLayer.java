package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The quantity and unit cost of one receiving event, an input to WAC.
 *
 * qtyRemaining is the part of qtyReceived still on hand. For a layer tied to
 * a lot it is the lot's remaining quantity; otherwise it is qtyReceived less
 * the draws recorded against the layer. priorWac and newWac snapshot the item's average cost just before and just
 * after this layer was added, for cost history reporting.
 */
@Value
public class CostLayer {
    UUID id;
    UUID orgId;
    UUID branchId;
    UUID itemId;
    UUID locationId;
    UUID lotId;
    BigDecimal qtyReceived;
    BigDecimal qtyRemaining;
    BigDecimal unitCost;
    BigDecimal priorWac;
    BigDecimal newWac;
    CostSourceType sourceType;
    String sourceId;
    String notes;
    UUID createdBy;
    Instant createdAt;

    public BigDecimal getExtendedCost() {
        return qtyReceived.multiply(unitCost);
    }
}
