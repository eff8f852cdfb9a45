package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FEFO ordering and allocation arithmetic, without a database.
 */
class FefoAllocatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 5);
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final FefoAllocator allocator = new FefoAllocator();

    private static Lot lot(String number, LocalDate expiry, String remaining, Instant createdAt) {
        BigDecimal qty = new BigDecimal(remaining);
        return new Lot(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            UUID.randomUUID(), number, qty.max(BigDecimal.ONE), qty, BigDecimal.TEN, expiry, null, null,
            LedgerSourceType.GOODS_RECEIPT, "GR-1", LotStatus.derive(qty, expiry, false, TODAY), createdAt);
    }

    @Test
    @DisplayName("Earliest expiry is consumed first and the remainder comes from the next lot")
    void earliestExpiryFirst() {
        // Given: lots expiring 2024-01-10 (10 left) and 2024-02-01 (20 left)
        Lot first = lot("L1", LocalDate.of(2024, 1, 10), "10", T0);
        Lot second = lot("L2", LocalDate.of(2024, 2, 1), "20", T0);

        // When
        AllocationPlan plan = allocator.plan(List.of(second, first), new BigDecimal("15"), true, TODAY);

        // Then
        assertEquals(2, plan.getAllocations().size());
        assertEquals(first.getId(), plan.getAllocations().get(0).getLotId());
        assertEquals(0, new BigDecimal("10").compareTo(plan.getAllocations().get(0).getAllocatedQty()));
        assertEquals(second.getId(), plan.getAllocations().get(1).getLotId());
        assertEquals(0, new BigDecimal("5").compareTo(plan.getAllocations().get(1).getAllocatedQty()));
        assertEquals(0, BigDecimal.ZERO.compareTo(plan.getShortfall()));
        assertTrue(plan.isFullyAllocated());
        assertEquals(1, plan.getAllocations().get(0).getAllocationOrder());
        assertEquals(2, plan.getAllocations().get(1).getAllocationOrder());
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Lots without expiry sort after every dated lot")
        void undatedLotsLast() {
            Lot undated = lot("NOEXP", null, "50", T0.minusSeconds(3600));
            Lot dated = lot("DATED", LocalDate.of(2030, 12, 31), "5", T0);

            AllocationPlan plan = allocator.plan(List.of(undated, dated), new BigDecimal("8"), true, TODAY);

            assertEquals("DATED", plan.getAllocations().get(0).getLotNumber());
            assertEquals("NOEXP", plan.getAllocations().get(1).getLotNumber());
            assertEquals(0, new BigDecimal("3").compareTo(plan.getAllocations().get(1).getAllocatedQty()));
        }

        @Test
        @DisplayName("Equal expiry falls back to creation time")
        void tieBrokenByCreatedAt() {
            LocalDate expiry = LocalDate.of(2024, 3, 1);
            Lot older = lot("OLD", expiry, "4", T0);
            Lot newer = lot("NEW", expiry, "4", T0.plusSeconds(60));

            AllocationPlan plan = allocator.plan(List.of(newer, older), new BigDecimal("4"), true, TODAY);

            assertEquals(1, plan.getAllocations().size());
            assertEquals("OLD", plan.getAllocations().get(0).getLotNumber());
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("Expired lots are skipped when excludeExpired is set")
        void expiredExcluded() {
            Lot expired = lot("EXP", LocalDate.of(2023, 12, 31), "10", T0);
            Lot fresh = lot("FRESH", LocalDate.of(2024, 6, 1), "10", T0);

            AllocationPlan plan = allocator.plan(List.of(expired, fresh), new BigDecimal("5"), true, TODAY);

            assertEquals(1, plan.getAllocations().size());
            assertEquals("FRESH", plan.getAllocations().get(0).getLotNumber());
        }

        @Test
        @DisplayName("Shortfall is reported, never an error")
        void shortfall() {
            Lot only = lot("L1", LocalDate.of(2024, 6, 1), "3", T0);

            AllocationPlan plan = allocator.plan(List.of(only), new BigDecimal("5"), true, TODAY);

            assertFalse(plan.isFullyAllocated());
            assertEquals(0, new BigDecimal("3").compareTo(plan.getTotalAllocated()));
            assertEquals(0, new BigDecimal("2").compareTo(plan.getShortfall()));
        }

        @Test
        @DisplayName("Depleted lots never appear in a plan")
        void depletedIgnored() {
            Lot empty = lot("EMPTY", LocalDate.of(2024, 1, 6), "0", T0);

            AllocationPlan plan = allocator.plan(List.of(empty), new BigDecimal("1"), true, TODAY);

            assertTrue(plan.getAllocations().isEmpty());
            assertEquals(0, BigDecimal.ONE.compareTo(plan.getShortfall()));
        }

        @Test
        @DisplayName("Non-positive quantity is rejected")
        void nonPositiveQuantity() {
            assertThrows(ValidationException.class,
                () -> allocator.plan(List.of(), BigDecimal.ZERO, true, TODAY));
        }
    }
}
