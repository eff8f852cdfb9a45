package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JournalLine {
    UUID id;
    UUID journalEntryId;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String lineType;
    UUID originalLineId;
    int lineNumber;
}
