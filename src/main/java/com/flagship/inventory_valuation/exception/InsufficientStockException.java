package com.flagship.inventory_valuation.exception;

import java.math.BigDecimal;

/**
 * Thrown when a movement would drive on-hand quantity, or a lot's remaining
 * quantity, below zero without an explicit override.
 */
public class InsufficientStockException extends InventoryException {

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientStockException(String message, BigDecimal available, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_STOCK, message);
        this.available = available;
        this.requested = requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
