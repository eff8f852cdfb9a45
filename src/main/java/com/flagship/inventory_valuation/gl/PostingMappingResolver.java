package com.flagship.inventory_valuation.gl;

import com.flagship.inventory_valuation.exception.UnconfiguredMappingException;

import java.util.UUID;

/**
 * Resolves the posting accounts for a branch.
 */
public interface PostingMappingResolver {

    /**
     * Returns the branch-specific mapping when one exists, else the org default.
     *
     * @throws UnconfiguredMappingException if neither exists
     */
    PostingMapping resolveMapping(UUID orgId, UUID branchId);
}
