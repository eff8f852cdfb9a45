package com.flagship.inventory_valuation.costing;

/**
 * What created a cost layer.
 */
public enum CostSourceType {
    GOODS_RECEIPT,
    PRODUCTION,
    TRANSFER,
    ADJUSTMENT
}
