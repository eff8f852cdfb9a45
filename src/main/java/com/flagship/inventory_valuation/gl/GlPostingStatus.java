package com.flagship.inventory_valuation.gl;

/**
 * Outcome of a GL posting attempt. GL is supplementary to inventory, so
 * SKIPPED and FAILED are reported here instead of thrown.
 */
public enum GlPostingStatus {
    POSTED,
    SKIPPED,
    FAILED
}
