package com.flagship.inventory_valuation.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports WARNING while audit events pile up or dead-letter, or while expired
 * lots are still eligible for FEFO because the sweep is behind. DOWN once the
 * audit backlog passes the critical mark.
 */
@Component("inventoryBacklog")
@RequiredArgsConstructor
public class BacklogHealthIndicator implements HealthIndicator {

    static final long OUTBOX_WARNING = 1_000;
    static final long OUTBOX_CRITICAL = 10_000;

    private final BacklogGauges gauges;

    @Override
    public Health health() {
        long pending = gauges.outboxPending();
        long deadLetters = gauges.outboxDeadLetters();
        long awaitingExpiry = gauges.lotsAwaitingExpiry();

        Health.Builder builder;
        if (pending >= OUTBOX_CRITICAL) {
            builder = Health.down();
        } else if (pending >= OUTBOX_WARNING || deadLetters > 0 || awaitingExpiry > 0) {
            builder = Health.status("WARNING");
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("outboxPending", pending)
                .withDetail("outboxDeadLetters", deadLetters)
                .withDetail("oldestPendingSeconds", gauges.oldestPendingSeconds())
                .withDetail("lotsAwaitingExpiry", awaitingExpiry)
                .build();
    }
}
