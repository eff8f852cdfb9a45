package com.flagship.inventory_valuation.gl;

public enum FiscalPeriodStatus {
    OPEN,
    CLOSED,
    LOCKED
}
