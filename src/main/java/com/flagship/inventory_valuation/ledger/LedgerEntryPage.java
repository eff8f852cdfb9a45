package com.flagship.inventory_valuation.ledger;

import lombok.Value;

import java.util.List;

@Value
public class LedgerEntryPage {
    List<LedgerEntry> entries;
    long total;
}
