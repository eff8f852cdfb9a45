package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * The journal a posting would write, without writing it.
 */
@Value
public class PostingPreview {
    GlDocumentType documentType;
    BigDecimal amount;
    List<Line> lines;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    public boolean isBalanced() {
        return totalDebit.compareTo(totalCredit) == 0;
    }

    @Value
    public static class Line {
        UUID accountId;
        String accountCode;
        String accountName;
        BigDecimal debit;
        BigDecimal credit;
    }
}
