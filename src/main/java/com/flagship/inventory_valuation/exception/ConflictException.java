package com.flagship.inventory_valuation.exception;

/**
 * Thrown when a unique business key is already taken by a different source,
 * e.g. a lot number reused by another receipt.
 */
public class ConflictException extends InventoryException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
