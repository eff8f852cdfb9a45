package com.flagship.inventory_valuation.ledger;

/**
 * Why a quantity moved. Stored on every ledger entry.
 *
 * Unconditional inbound reasons record physical arrivals and are never
 * checked against current on-hand.
 */
public enum LedgerEntryReason {
    PURCHASE(true),
    SALE(false),
    WASTAGE(false),
    ADJUSTMENT(false),
    COUNT_ADJUSTMENT(false),
    CYCLE_COUNT(false),
    TRANSFER_IN(true),
    TRANSFER_OUT(false),
    INITIAL(true),
    VENDOR_RETURN(false),
    PRODUCTION_CONSUME(false),
    PRODUCTION_PRODUCE(true);

    private final boolean unconditionalInbound;

    LedgerEntryReason(boolean unconditionalInbound) {
        this.unconditionalInbound = unconditionalInbound;
    }

    public boolean isUnconditionalInbound() {
        return unconditionalInbound;
    }
}
