package com.flagship.inventory_valuation.costing;

import lombok.Value;

import java.util.UUID;

@Value
public class ModifierSelection {
    UUID modifierOptionId;
    boolean selected;
}
