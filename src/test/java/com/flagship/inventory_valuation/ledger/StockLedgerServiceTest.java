package com.flagship.inventory_valuation.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.inventory_valuation.exception.InsufficientStockException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import com.flagship.inventory_valuation.reconciliation.StockReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stock ledger tests: try to drive on-hand negative or out of line with the ledger.
 *
 * These tests verify that:
 * - On-hand is always SUM(qty) of the ledger
 * - Outbound movements never take on-hand below zero unless explicitly allowed
 * - Concurrent writers on the same position are serialized
 * - Ledger rows cannot be changed once written
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class StockLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("inventory_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No Kafka, Redis or scheduled sweeps in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("inventory.gl.idempotency-cache.enabled", () -> "false");
        registry.add("inventory.lots.expiry-sweep.enabled", () -> "false");
    }

    @Autowired
    private StockLedgerService ledgerService;

    @Autowired
    private StockReconciliationService reconciliationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InventoryMetrics metrics;

    private UUID orgId;
    private UUID branchId;
    private UUID itemId;
    private UUID locationId;

    @BeforeEach
    void setUp() {
        orgId = UUID.randomUUID();
        branchId = UUID.randomUUID();
        itemId = UUID.randomUUID();
        locationId = UUID.randomUUID();
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerEntry record(String qty, LedgerEntryReason reason) {
        return ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
            .itemId(itemId)
            .locationId(locationId)
            .qty(new BigDecimal(qty))
            .reason(reason)
            .sourceType(LedgerSourceType.MANUAL)
            .sourceId("T-" + UUID.randomUUID())
            .build());
    }

    private BigDecimal onHand() {
        return ledgerService.getOnHand(itemId, locationId, branchId);
    }

    @Nested
    @DisplayName("1. Recording movements")
    class Recording {

        @Test
        @DisplayName("1.1 On-hand is the sum of every entry")
        void onHandIsSumOfEntries() {
            printTestHeader("On-hand equals SUM(qty)");

            // Given: a purchase, a sale and a positive adjustment
            record("10", LedgerEntryReason.PURCHASE);
            record("-3.5", LedgerEntryReason.SALE);
            LedgerEntry last = record("1.25", LedgerEntryReason.ADJUSTMENT);
            printOutput("Last entry", last.getId());

            // Then
            printOutput("On-hand", onHand());
            assertEquals(0, new BigDecimal("7.75").compareTo(onHand()));
            assertEquals(0, new BigDecimal("7.75").compareTo(ledgerService.getCachedOnHand(itemId, locationId, branchId)));
            assertNotNull(last.getSequenceNumber());
            printSuccess("On-hand derived from the ledger");
        }

        @Test
        @DisplayName("1.2 Outbound movement beyond on-hand is rejected and writes nothing")
        void insufficientStock() {
            printTestHeader("Insufficient stock");
            record("5", LedgerEntryReason.PURCHASE);
            printInput("Sale", "-6");

            InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> record("-6", LedgerEntryReason.SALE));

            printOutput("Error", e.getMessage());
            assertEquals(0, new BigDecimal("5").compareTo(e.getAvailable()));
            assertEquals(0, new BigDecimal("6").compareTo(e.getRequested()));
            assertEquals(0, new BigDecimal("5").compareTo(onHand()));
            assertEquals(1, ledgerService.getLedgerEntries(orgId, branchId,
                LedgerEntryFilter.builder().itemId(itemId).build()).getTotal());
            printSuccess("Negative on-hand prevented");
        }

        @Test
        @DisplayName("1.3 allowNegative and count adjustments may go below zero")
        void negativeWhenAllowed() {
            printTestHeader("Explicitly allowed negative");

            ledgerService.recordAdjustment(orgId, branchId, itemId, locationId, new BigDecimal("-2"),
                null, "ADJ-1", "correction", true);
            ledgerService.recordCountAdjustment(orgId, branchId, itemId, locationId, new BigDecimal("-1"),
                "COUNT-1", null);

            assertEquals(0, new BigDecimal("-3").compareTo(onHand()));
            printSuccess("Override respected");
        }

        @Test
        @DisplayName("1.4 Unconditional inbound reasons are never checked")
        void inboundNeverChecked() {
            ledgerService.recordAdjustment(orgId, branchId, itemId, locationId, new BigDecimal("-4"),
                null, "ADJ-2", null, true);

            record("1", LedgerEntryReason.PURCHASE);

            assertEquals(0, new BigDecimal("-3").compareTo(onHand()));
        }

        @Test
        @DisplayName("1.5 Zero quantity is a validation error")
        void zeroQuantity() {
            assertThrows(ValidationException.class, () -> record("0", LedgerEntryReason.ADJUSTMENT));
        }

        @Test
        @DisplayName("1.6 Metadata round-trips through the jsonb column")
        void metadataStored() {
            LedgerEntry entry = ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                .itemId(itemId)
                .locationId(locationId)
                .qty(BigDecimal.ONE)
                .reason(LedgerEntryReason.INITIAL)
                .sourceType(LedgerSourceType.MANUAL)
                .sourceId("INIT-1")
                .metadata(Map.of("line", 1))
                .build());

            List<LedgerEntry> stored = ledgerService.getEntriesForSource(orgId, LedgerSourceType.MANUAL, "INIT-1");
            assertEquals(1, stored.size());
            assertEquals(entry.getId(), stored.get(0).getId());
            assertEquals(1, ((Number) stored.get(0).getMetadata().get("line")).intValue());
        }
    }

    @Nested
    @DisplayName("2. Queries")
    class Queries {

        @Test
        @DisplayName("2.1 Ledger listing filters by reason and pages newest first")
        void filteredListing() {
            record("10", LedgerEntryReason.PURCHASE);
            record("-1", LedgerEntryReason.SALE);
            record("-2", LedgerEntryReason.SALE);
            record("-3", LedgerEntryReason.SALE);

            LedgerEntryPage page = ledgerService.getLedgerEntries(orgId, branchId, LedgerEntryFilter.builder()
                .reason(LedgerEntryReason.SALE)
                .limit(2)
                .build());

            assertEquals(3, page.getTotal());
            assertEquals(2, page.getEntries().size());
            assertEquals(0, new BigDecimal("-3").compareTo(page.getEntries().get(0).getQty()));
        }

        @Test
        @DisplayName("2.2 On-hand by location and by branch")
        void groupedOnHand() {
            UUID otherLocation = UUID.randomUUID();
            record("4", LedgerEntryReason.PURCHASE);
            ledgerService.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                .itemId(itemId)
                .locationId(otherLocation)
                .qty(new BigDecimal("6"))
                .reason(LedgerEntryReason.PURCHASE)
                .sourceType(LedgerSourceType.MANUAL)
                .build());

            List<OnHandResult> byLocation = ledgerService.getOnHandByLocation(itemId, branchId);
            assertEquals(2, byLocation.size());
            assertEquals(1, ledgerService.getOnHandByBranch(branchId, otherLocation).size());
            assertEquals(2, ledgerService.getOnHandByBranch(branchId, null).size());
        }
    }

    @Nested
    @DisplayName("3. Concurrency")
    class Concurrency {

        @Test
        @DisplayName("3.1 Concurrent sales never oversell")
        void concurrentSalesDoNotOversell() throws InterruptedException {
            printTestHeader("Concurrent sales against 10 units");
            record("10", LedgerEntryReason.PURCHASE);

            int threads = 15;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threads);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        record("-1", LedgerEntryReason.SALE);
                        succeeded.incrementAndGet();
                    } catch (InsufficientStockException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "All sales should finish");
            executor.shutdown();

            printOutput("Succeeded", succeeded.get());
            printOutput("Rejected", rejected.get());
            assertEquals(10, succeeded.get());
            assertEquals(5, rejected.get());
            assertEquals(0, BigDecimal.ZERO.compareTo(onHand()));
            printSuccess("Writers serialized on the balance row");
        }
    }

    @Nested
    @DisplayName("4. Append-only and balance cache")
    class AppendOnly {

        @Test
        @DisplayName("4.1 Ledger rows cannot be updated or deleted")
        void ledgerIsAppendOnly() {
            LedgerEntry entry = record("3", LedgerEntryReason.PURCHASE);

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE inventory_ledger_entries SET qty = 100 WHERE id = ?", entry.getId()));
            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM inventory_ledger_entries WHERE id = ?", entry.getId()));
            assertEquals(0, new BigDecimal("3").compareTo(onHand()));
        }

        @Test
        @DisplayName("4.2 A drifted cached balance is reported and rebuilt from the ledger")
        void driftRepaired() {
            printTestHeader("Balance drift repair");
            record("8", LedgerEntryReason.PURCHASE);
            jdbcTemplate.update(
                "UPDATE inventory_stock_balances SET on_hand = 99 WHERE branch_id = ? AND item_id = ?",
                branchId, itemId);

            List<BalanceDrift> drifts = reconciliationService.reconcileBalances(orgId);

            printOutput("Drifts", drifts);
            assertEquals(1, drifts.size());
            assertEquals(0, new BigDecimal("99").compareTo(drifts.get(0).getCachedOnHand()));
            assertEquals(0, new BigDecimal("-91").compareTo(drifts.get(0).getDifference()));
            assertEquals(0, new BigDecimal("8").compareTo(ledgerService.getCachedOnHand(itemId, locationId, branchId)));
            assertTrue(reconciliationService.reconcileBalances(orgId).isEmpty());
            printSuccess("Ledger remains the source of truth");
        }
    }

    @Nested
    @DisplayName("5. Timestamps")
    class Timestamps {

        @Test
        @DisplayName("5.1 Entries are stamped from the injected clock")
        void createdAtComesFromClock() {
            printTestHeader("Ledger entry timestamp");
            Instant fixed = Instant.parse("2024-03-01T10:00:00Z");
            StockLedgerService fixedClockLedger = new StockLedgerService(
                jdbcTemplate, objectMapper, metrics, Clock.fixed(fixed, ZoneOffset.UTC));

            LedgerEntry entry = fixedClockLedger.recordEntry(orgId, branchId, RecordEntryRequest.builder()
                .itemId(itemId)
                .locationId(locationId)
                .qty(new BigDecimal("4"))
                .reason(LedgerEntryReason.PURCHASE)
                .sourceType(LedgerSourceType.MANUAL)
                .sourceId("T-CLOCK")
                .build());

            printOutput("Created at", entry.getCreatedAt());
            assertEquals(fixed, entry.getCreatedAt());
            Instant stored = jdbcTemplate.queryForObject(
                "SELECT created_at FROM inventory_ledger_entries WHERE id = ?",
                (rs, rowNum) -> rs.getTimestamp("created_at").toInstant(), entry.getId());
            assertEquals(fixed, stored);
            printSuccess("Ledger time follows the application clock");
        }
    }
}
