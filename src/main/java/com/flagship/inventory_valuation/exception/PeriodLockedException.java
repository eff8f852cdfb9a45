package com.flagship.inventory_valuation.exception;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Thrown when a financial posting is dated inside a LOCKED fiscal period.
 *
 * Never caught by the GL poster: it must abort the whole enclosing
 * inventory operation.
 */
public class PeriodLockedException extends InventoryException {

    private final UUID periodId;
    private final LocalDate postingDate;

    public PeriodLockedException(UUID periodId, String periodName, LocalDate postingDate) {
        super(ErrorCode.PERIOD_LOCKED,
            String.format("Cannot post on %s in locked fiscal period: %s", postingDate, periodName));
        this.periodId = periodId;
        this.postingDate = postingDate;
    }

    public UUID getPeriodId() {
        return periodId;
    }

    public LocalDate getPostingDate() {
        return postingDate;
    }
}
