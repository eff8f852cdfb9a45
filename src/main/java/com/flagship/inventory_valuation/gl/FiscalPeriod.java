package com.flagship.inventory_valuation.gl;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class FiscalPeriod {
    UUID id;
    UUID orgId;
    String name;
    LocalDate startsOn;
    LocalDate endsOn;
    FiscalPeriodStatus status;

    public boolean isLocked() {
        return status == FiscalPeriodStatus.LOCKED;
    }
}
