package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * First-Expiry-First-Out allocation over a set of candidate lots.
 *
 * Pure computation: no lot is read from or written to the store here.
 *
 * Ordering key is (hasNoExpiry, expiryDate, createdAt, id), so lots without an
 * expiry always come after every dated lot regardless of how the input was sorted.
 */
@Component
public class FefoAllocator {

    static final Comparator<Lot> FEFO_ORDER = Comparator
        .comparing((Lot lot) -> !lot.hasExpiry())
        .thenComparing(lot -> lot.hasExpiry() ? lot.getExpiryDate() : LocalDate.MAX)
        .thenComparing(Lot::getCreatedAt)
        .thenComparing(Lot::getId);

    /**
     * Plans how to satisfy {@code qtyNeeded} from the given lots.
     *
     * Only ACTIVE lots with remaining quantity are considered. When
     * {@code excludeExpired} is set, lots whose expiry date is before
     * {@code today} are skipped as well.
     */
    public AllocationPlan plan(List<Lot> candidates, BigDecimal qtyNeeded,
                               boolean excludeExpired, LocalDate today) {
        if (qtyNeeded == null || qtyNeeded.signum() <= 0) {
            throw new ValidationException("Quantity needed must be positive");
        }

        List<Lot> eligible = candidates.stream()
            .filter(lot -> lot.getStatus() == LotStatus.ACTIVE)
            .filter(lot -> lot.getRemainingQty().signum() > 0)
            .filter(lot -> !excludeExpired || !lot.isExpired(today))
            .sorted(FEFO_ORDER)
            .toList();

        List<FefoAllocation> allocations = new ArrayList<>();
        BigDecimal remaining = qtyNeeded;
        int order = 1;

        for (Lot lot : eligible) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal take = remaining.min(lot.getRemainingQty());
            allocations.add(new FefoAllocation(
                lot.getId(), lot.getLotNumber(), take, lot.getExpiryDate(), order++));
            remaining = remaining.subtract(take);
        }

        BigDecimal shortfall = remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
        return new AllocationPlan(List.copyOf(allocations), qtyNeeded.subtract(shortfall), shortfall);
    }
}
