package com.flagship.inventory_valuation.exception;

import java.util.UUID;

/**
 * Thrown by the account-mapping resolver when neither a branch-specific nor an
 * org-level posting mapping exists. The GL poster turns this into a FAILED
 * posting result; inventory mutations still go through.
 */
public class UnconfiguredMappingException extends InventoryException {

    public UnconfiguredMappingException(UUID orgId, UUID branchId) {
        super(ErrorCode.UNCONFIGURED,
            String.format("No inventory posting mapping configured for org %s, branch %s", orgId, branchId));
    }
}
