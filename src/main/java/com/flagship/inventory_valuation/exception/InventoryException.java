package com.flagship.inventory_valuation.exception;

/**
 * Base type for failures raised by the inventory core.
 *
 * All subtypes are unchecked: they surface synchronously to the caller and
 * roll back the enclosing transaction unless explicitly caught.
 */
public abstract class InventoryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected InventoryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected InventoryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
