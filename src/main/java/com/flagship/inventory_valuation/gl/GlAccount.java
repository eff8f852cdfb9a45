package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.util.UUID;

@Value
public class GlAccount {
    UUID id;
    UUID orgId;
    String code;
    String name;
}
