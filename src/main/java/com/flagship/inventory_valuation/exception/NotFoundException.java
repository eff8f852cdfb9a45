package com.flagship.inventory_valuation.exception;

/**
 * Thrown when a referenced lot, journal or other record does not exist.
 */
public class NotFoundException extends InventoryException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
