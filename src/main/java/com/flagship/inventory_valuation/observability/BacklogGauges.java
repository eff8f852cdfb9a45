package com.flagship.inventory_valuation.observability;

import com.flagship.inventory_valuation.lot.LotRepository;
import com.flagship.inventory_valuation.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work that is waiting on a background job: audit events not yet relayed
 * and lots past expiry that the sweep has not picked up.
 *
 * Counts are refreshed on a schedule and cached, so scrapes and health
 * checks never query the database themselves.
 *
 * Gauges:
 * - inventory.outbox.pending: unpublished audit events
 * - inventory.outbox.dead_letters: events that exhausted their retries
 * - inventory.outbox.oldest_pending_seconds: age of the oldest unpublished event
 * - inventory.lots.awaiting_expiry: ACTIVE lots with stock past their expiry date
 */
@Component
@Slf4j
public class BacklogGauges {

    private final OutboxEventRepository outboxRepository;
    private final LotRepository lotRepository;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong outboxPending = new AtomicLong();
    private final AtomicLong outboxDeadLetters = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong lotsAwaitingExpiry = new AtomicLong();

    public BacklogGauges(
            OutboxEventRepository outboxRepository,
            LotRepository lotRepository,
            Clock clock,
            MeterRegistry registry,
            @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.lotRepository = lotRepository;
        this.clock = clock;
        this.maxRetries = maxRetries;

        Gauge.builder("inventory.outbox.pending", outboxPending, AtomicLong::get)
                .description("Audit events waiting to be relayed")
                .register(registry);
        Gauge.builder("inventory.outbox.dead_letters", outboxDeadLetters, AtomicLong::get)
                .description("Audit events that exhausted their relay retries")
                .register(registry);
        Gauge.builder("inventory.outbox.oldest_pending_seconds", oldestPendingSeconds, AtomicLong::get)
                .baseUnit("seconds")
                .register(registry);
        Gauge.builder("inventory.lots.awaiting_expiry", lotsAwaitingExpiry, AtomicLong::get)
                .description("Active lots past their expiry date")
                .register(registry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            Instant now = clock.instant();
            outboxPending.set(outboxRepository.countUnpublished());
            outboxDeadLetters.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(createdAt -> Math.max(0, Duration.between(createdAt, now).getSeconds()))
                    .orElse(0L));
            lotsAwaitingExpiry.set(lotRepository.countAwaitingExpiry(LocalDate.now(clock)));
        } catch (Exception e) {
            log.warn("Backlog gauge refresh failed, keeping previous values: {}", e.getMessage());
        }
    }

    public long outboxPending() {
        return outboxPending.get();
    }

    public long outboxDeadLetters() {
        return outboxDeadLetters.get();
    }

    public long oldestPendingSeconds() {
        return oldestPendingSeconds.get();
    }

    public long lotsAwaitingExpiry() {
        return lotsAwaitingExpiry.get();
    }
}
