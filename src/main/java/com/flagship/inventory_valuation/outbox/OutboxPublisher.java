package com.flagship.inventory_valuation.outbox;

import com.flagship.inventory_valuation.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Relays committed audit events to the inventory events topic.
 *
 * Records are keyed by aggregate id so all events of one journal or lot land
 * on the same partition in order. The org and event type travel as headers
 * for consumers that route without parsing the payload. An event that has
 * failed {@code max-retries} times stays in the table as a dead letter and is
 * no longer claimed.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    static final String HEADER_EVENT_TYPE = "event-type";
    static final String HEADER_ORG_ID = "org-id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final InventoryMetrics metrics;
    private final String topic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           InventoryMetrics metrics,
                           @Value("${kafka.topic.inventory-events:inventory-events}") String topic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.metrics = metrics;
        this.topic = topic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (Exception e) {
            log.error("Could not claim outbox events", e);
            return;
        }
        int relayed = 0;
        for (OutboxEvent event : batch) {
            String outcome = relay(event);
            metrics.recordOutboxRelay(event.getEventType(), outcome);
            if ("success".equals(outcome)) {
                relayed++;
            }
        }
        if (!batch.isEmpty()) {
            log.debug("Relayed {}/{} outbox events to {}", relayed, batch.size(), topic);
        }
    }

    private String relay(OutboxEvent event) {
        try {
            RecordMetadata sent = kafkaTemplate.send(toRecord(event)).get().getRecordMetadata();
            outboxService.markPublished(event.getId());
            log.debug("Event {} -> {}-{}@{}", event.getId(), sent.topic(), sent.partition(), sent.offset());
            return "success";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(event, "Interrupted while publishing");
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Relay of event {} ({}) failed: {}", event.getId(), event.getEventType(), cause.getMessage());
            return fail(event, cause.getMessage());
        }
    }

    private String fail(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} ({} on {} {}) is now a dead letter after {} attempts",
                event.getId(), event.getEventType(), event.getAggregateType(), event.getAggregateId(), maxRetries);
            return "dead_letter";
        }
        return "failure";
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(HEADER_EVENT_TYPE, event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getOrgId() != null) {
            record.headers().add(HEADER_ORG_ID, event.getOrgId().toString().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }
}
