package com.flagship.inventory_valuation.exception;

/**
 * Machine-readable failure categories shared by all inventory operations.
 */
public enum ErrorCode {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INSUFFICIENT_STOCK,
    PERIOD_LOCKED,
    UNCONFIGURED
}
