package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.util.UUID;

/**
 * Chart-of-accounts accounts used for inventory postings of one org or branch.
 *
 * {@code inventoryGainAccountId} is optional; stocktake gains fall back to the
 * shrink account when it is absent.
 */
@Value
public class PostingMapping {
    UUID orgId;
    UUID branchId;
    UUID inventoryAssetAccountId;
    UUID cogsAccountId;
    UUID wasteExpenseAccountId;
    UUID shrinkExpenseAccountId;
    UUID grniAccountId;
    UUID inventoryGainAccountId;

    public UUID gainOrShrinkAccountId() {
        return inventoryGainAccountId != null ? inventoryGainAccountId : shrinkExpenseAccountId;
    }

    public boolean isOrgDefault() {
        return branchId == null;
    }
}
