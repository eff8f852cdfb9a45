package com.flagship.inventory_valuation.gl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for "has this document already been journaled?".
 *
 * Only a latency optimization: a miss, or Redis being down, falls through to
 * the database, and the unique key on journal_entries stays authoritative.
 * Ids are written only after the posting transaction commits, so a cached id
 * always refers to a committed journal.
 */
@Component
@Slf4j
public class JournalIdempotencyCache {

    private static final String REDIS_KEY_PREFIX = "gl-journal:";

    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public JournalIdempotencyCache(Optional<RedisTemplate<String, String>> redisTemplate,
                                   @Value("${inventory.gl.idempotency-cache.enabled:true}") boolean enabled,
                                   @Value("${inventory.gl.idempotency-cache.ttl:P7D}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    public Optional<UUID> lookup(UUID orgId, String source, String sourceId) {
        if (!isActive()) {
            return Optional.empty();
        }
        String key = key(orgId, source, sourceId);
        try {
            String journalId = redisTemplate.get().opsForValue().get(key);
            if (journalId != null) {
                log.debug("Journal found in Redis for {}", key);
                return Optional.of(UUID.fromString(journalId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for {}. Falling back to database. Error: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Caches the journal id once the surrounding transaction commits, or right
     * away when there is none.
     */
    public void storeAfterCommit(UUID orgId, String source, String sourceId, UUID journalId) {
        if (!isActive()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    store(orgId, source, sourceId, journalId);
                }
            });
        } else {
            store(orgId, source, sourceId, journalId);
        }
    }

    private void store(UUID orgId, String source, String sourceId, UUID journalId) {
        String key = key(orgId, source, sourceId);
        try {
            redisTemplate.get().opsForValue().set(key, journalId.toString(), ttl);
            log.debug("Cached journal {} under {}", journalId, key);
        } catch (Exception e) {
            log.warn("Failed to cache journal in Redis: {}. Error: {}", key, e.getMessage());
        }
    }

    private boolean isActive() {
        return enabled && redisTemplate.isPresent();
    }

    private static String key(UUID orgId, String source, String sourceId) {
        return REDIS_KEY_PREFIX + orgId + ":" + source + ":" + sourceId;
    }
}
