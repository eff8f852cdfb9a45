package com.flagship.inventory_valuation.gl;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds the fiscal period containing a date, if the org has defined one.
 */
public interface FiscalPeriodLookup {

    Optional<FiscalPeriod> findPeriod(UUID orgId, LocalDate date);
}
