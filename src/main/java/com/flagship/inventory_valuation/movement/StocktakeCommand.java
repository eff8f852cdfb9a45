package com.flagship.inventory_valuation.movement;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class StocktakeCommand {
    UUID orgId;
    UUID branchId;
    String sessionId;
    UUID actorId;
    @Singular
    List<CountLine> lines;
}
