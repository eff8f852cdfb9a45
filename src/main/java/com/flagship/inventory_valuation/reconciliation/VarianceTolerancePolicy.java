package com.flagship.inventory_valuation.reconciliation;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides whether a count variance is small enough to be accepted silently.
 *
 * In RELATIVE mode the absolute tolerance still acts as a floor, so counts of
 * items with no expected value are not flagged for rounding noise.
 */
@Component
@Getter
public class VarianceTolerancePolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final VarianceToleranceMode mode;
    private final BigDecimal absoluteTolerance;
    private final BigDecimal relativeTolerancePct;

    public VarianceTolerancePolicy(
            @Value("${inventory.reconciliation.tolerance-mode:ABSOLUTE}") VarianceToleranceMode mode,
            @Value("${inventory.reconciliation.absolute-tolerance:0.01}") BigDecimal absoluteTolerance,
            @Value("${inventory.reconciliation.relative-tolerance-pct:0.5}") BigDecimal relativeTolerancePct) {
        this.mode = mode;
        this.absoluteTolerance = absoluteTolerance;
        this.relativeTolerancePct = relativeTolerancePct;
    }

    public boolean isWithinTolerance(BigDecimal varianceValue, BigDecimal expectedValue) {
        return varianceValue.abs().compareTo(allowedVariance(expectedValue)) <= 0;
    }

    BigDecimal allowedVariance(BigDecimal expectedValue) {
        if (mode == VarianceToleranceMode.ABSOLUTE) {
            return absoluteTolerance;
        }
        BigDecimal scaled = expectedValue.abs().multiply(relativeTolerancePct).divide(HUNDRED);
        return scaled.max(absoluteTolerance);
    }
}
