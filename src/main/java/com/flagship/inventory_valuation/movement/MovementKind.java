package com.flagship.inventory_valuation.movement;

/**
 * Business operations tracked by the movement document registry.
 * A (org, kind, sourceId) triple is applied at most once.
 */
public enum MovementKind {
    GOODS_RECEIPT,
    GOODS_RECEIPT_VOID,
    DEPLETION,
    WASTE,
    WASTE_VOID,
    STOCKTAKE
}
