package com.flagship.inventory_valuation.movement;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class WasteCommand {
    UUID orgId;
    UUID branchId;
    String wasteId;
    UUID actorId;
    String notes;
    @Singular
    List<StockLine> lines;
}
