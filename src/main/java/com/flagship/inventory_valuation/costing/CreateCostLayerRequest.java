package com.flagship.inventory_valuation.costing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreateCostLayerRequest {
    UUID itemId;
    UUID locationId;
    /** Lot received with this layer; its remaining quantity then drives the layer's. */
    UUID lotId;
    BigDecimal qtyReceived;
    BigDecimal unitCost;
    CostSourceType sourceType;
    String sourceId;
    String notes;
}
