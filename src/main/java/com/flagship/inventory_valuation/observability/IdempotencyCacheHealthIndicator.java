package com.flagship.inventory_valuation.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Redis only holds the journal idempotency shortcut; postings still dedupe
 * through the database unique key. An unreachable Redis is DEGRADED.
 */
@Component("glIdempotencyCache")
@ConditionalOnProperty(name = "inventory.gl.idempotency-cache.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class IdempotencyCacheHealthIndicator implements HealthIndicator {

    private final RedisConnectionFactory connectionFactory;

    @Override
    public Health health() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            String reply = connection.ping();
            return "PONG".equals(reply)
                    ? Health.up().build()
                    : degraded("unexpected ping reply: " + reply);
        } catch (Exception e) {
            return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private Health degraded(String reason) {
        return Health.status("DEGRADED")
                .withDetail("reason", reason)
                .withDetail("fallback", "journal lookup by (org, source, sourceId)")
                .build();
    }
}
