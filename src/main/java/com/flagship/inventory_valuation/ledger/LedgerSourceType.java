package com.flagship.inventory_valuation.ledger;

/**
 * Kind of business document that produced a ledger entry.
 */
public enum LedgerSourceType {
    GOODS_RECEIPT,
    ORDER,
    WASTAGE,
    STOCK_ADJUSTMENT,
    COUNT_SESSION,
    TRANSFER,
    MANUAL,
    VENDOR_RETURN,
    PRODUCTION
}
