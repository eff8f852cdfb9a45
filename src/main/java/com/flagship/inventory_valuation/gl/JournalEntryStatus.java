package com.flagship.inventory_valuation.gl;

public enum JournalEntryStatus {
    POSTED,
    REVERSED
}
