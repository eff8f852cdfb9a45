package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.util.UUID;

/**
 * Result of a post or void. {@code idempotent} marks a repeat call that found
 * the work already done; it is a success, not an error.
 */
@Value
public class GlPostingResult {
    UUID journalEntryId;
    GlPostingStatus status;
    String error;
    boolean idempotent;

    public static GlPostingResult posted(UUID journalEntryId) {
        return new GlPostingResult(journalEntryId, GlPostingStatus.POSTED, null, false);
    }

    public static GlPostingResult alreadyPosted(UUID journalEntryId) {
        return new GlPostingResult(journalEntryId, GlPostingStatus.POSTED, null, true);
    }

    public static GlPostingResult skipped(String reason) {
        return new GlPostingResult(null, GlPostingStatus.SKIPPED, reason, false);
    }

    /**
     * A void whose original was already reversed. Carries the existing reversal.
     */
    public static GlPostingResult alreadyReversed(UUID reversalEntryId) {
        return new GlPostingResult(reversalEntryId, GlPostingStatus.SKIPPED, "Original journal already reversed", true);
    }

    public static GlPostingResult failed(String reason) {
        return new GlPostingResult(null, GlPostingStatus.FAILED, reason, false);
    }

    public boolean isPosted() {
        return status == GlPostingStatus.POSTED;
    }
}
