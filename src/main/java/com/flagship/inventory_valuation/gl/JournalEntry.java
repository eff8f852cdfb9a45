package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A posted double-entry journal. (orgId, source, sourceId) is unique.
 *
 * Lines are never edited. A void creates a second entry with every line
 * swapped and flips this one to REVERSED.
 */
@Value
public class JournalEntry {
    UUID id;
    UUID orgId;
    UUID branchId;
    LocalDate entryDate;
    String memo;
    String source;
    String sourceId;
    JournalEntryStatus status;
    UUID reversesEntryId;
    UUID postedBy;
    Instant postedAt;
    UUID reversedBy;
    Instant reversedAt;
    List<JournalLine> lines;

    public BigDecimal getTotalDebit() {
        return lines.stream().map(JournalLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalCredit() {
        return lines.stream().map(JournalLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getTotalDebit().compareTo(getTotalCredit()) == 0;
    }

    public boolean isReversal() {
        return reversesEntryId != null;
    }
}
