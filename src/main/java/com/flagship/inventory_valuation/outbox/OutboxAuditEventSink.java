package com.flagship.inventory_valuation.outbox;

import com.flagship.inventory_valuation.audit.AuditEvent;
import com.flagship.inventory_valuation.audit.AuditEventSink;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Audit sink backed by the outbox.
 *
 * Events are written after the caller's transaction commits, in a transaction
 * of their own. A failure here is logged and counted, and never reaches the
 * caller.
 */
@Component
@Slf4j
public class OutboxAuditEventSink implements AuditEventSink {

    private final OutboxService outboxService;
    private final TransactionTemplate requiresNew;
    private final InventoryMetrics metrics;

    public OutboxAuditEventSink(OutboxService outboxService,
                                PlatformTransactionManager transactionManager,
                                InventoryMetrics metrics) {
        this.outboxService = outboxService;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.metrics = metrics;
    }

    @Override
    public void record(AuditEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(event);
                }
            });
        } else {
            write(event);
        }
    }

    private void write(AuditEvent event) {
        try {
            requiresNew.executeWithoutResult(status -> outboxService.saveEvent(
                event.getOrgId(),
                event.getResourceType(),
                event.getResourceId(),
                event.getAction(),
                event));
        } catch (Exception e) {
            metrics.recordAuditFailure(event.getAction());
            log.warn("Failed to record audit event {} for {} {}: {}",
                event.getAction(), event.getResourceType(), event.getResourceId(), e.getMessage());
        }
    }
}
