package com.flagship.inventory_valuation.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An audit event for a journal or lot, held until it has been relayed to Kafka.
 * {@code publishedAt} stays null until the relay succeeds.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID orgId;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(UUID orgId, String aggregateType, UUID aggregateId,
                               String eventType, String payloadJson, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), orgId, aggregateType, aggregateId,
            eventType, payloadJson, now, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
