package com.flagship.inventory_valuation.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Outbox table access: appends audit events and records relay outcomes.
 * Nothing here talks to Kafka; {@link OutboxPublisher} does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Appends an event as part of the caller's transaction; fails when there is none.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(UUID orgId, String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent pending = OutboxEvent.pending(orgId, aggregateType, aggregateId, eventType,
            toJson(eventType, payload), clock.instant());
        OutboxEvent stored = repository.save(OutboxEventEntity.fromDomain(pending)).toDomain();
        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return stored;
    }

    /**
     * Claims the oldest pending events that have failed fewer than
     * {@code maxRetries} times. Rows held by another relay are skipped.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return toEvents(repository.findUnpublishedEventsForUpdate(limit, maxRetries));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return findUnpublishedEvents(limit, Integer.MAX_VALUE);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        update(eventId, entity -> entity.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        update(eventId, entity -> {
            entity.markFailed(errorMessage);
            log.warn("Relay attempt {} failed for event {}: {}", entity.getRetryCount(), eventId, errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return toEvents(repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId));
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsByType(String eventType) {
        return toEvents(repository.findByEventTypeOrderBySequenceNumberAsc(eventType));
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private void update(UUID eventId, Consumer<OutboxEventEntity> change) {
        OutboxEventEntity entity = repository.findById(eventId).orElse(null);
        if (entity == null) {
            log.debug("Outbox event {} no longer exists", eventId);
            return;
        }
        change.accept(entity);
        repository.save(entity);
    }

    private static List<OutboxEvent> toEvents(List<OutboxEventEntity> entities) {
        return entities.stream().map(OutboxEventEntity::toDomain).toList();
    }

    private String toJson(String eventType, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize payload of " + eventType, e);
        }
    }
}
