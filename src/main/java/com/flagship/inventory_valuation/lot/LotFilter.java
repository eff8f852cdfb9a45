package com.flagship.inventory_valuation.lot;

import lombok.Builder;
import lombok.Value;

import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class LotFilter {
    UUID orgId;
    UUID branchId;
    UUID itemId;
    UUID locationId;
    Set<LotStatus> statuses;
    boolean includeExpired;
    boolean includeDepleted;
    @Builder.Default
    int limit = 50;
    @Builder.Default
    int offset = 0;
}
