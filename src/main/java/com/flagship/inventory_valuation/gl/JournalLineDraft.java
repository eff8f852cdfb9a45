package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A journal line before it is written. Exactly one of debit and credit is non-zero.
 */
@Value
public class JournalLineDraft {
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String lineType;

    public static JournalLineDraft debit(UUID accountId, BigDecimal amount, String lineType) {
        return new JournalLineDraft(accountId, amount, BigDecimal.ZERO, lineType);
    }

    public static JournalLineDraft credit(UUID accountId, BigDecimal amount, String lineType) {
        return new JournalLineDraft(accountId, BigDecimal.ZERO, amount, lineType);
    }
}
