package com.flagship.inventory_valuation.exception;

/**
 * Thrown when an operation receives malformed or out-of-range input.
 */
public class ValidationException extends InventoryException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
