package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.AuditEvent;
import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands audit events to the {@link AuditSink} off the caller's thread. Delivery
 * goes through the {@code auditRetry} policy; a final failure is logged with
 * the full event and never reaches the caller.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditSink auditSink;
    private final AuditRecordRepository auditRecordRepository;
    private final Executor governanceExecutor;
    private final Clock clock;
    private final Retry auditRetry;

    public AuditService(
            AuditSink auditSink,
            AuditRecordRepository auditRecordRepository,
            @Qualifier("governanceExecutor") Executor governanceExecutor,
            Clock clock,
            @Qualifier("auditRetry") Retry auditRetry) {
        this.auditSink = auditSink;
        this.auditRecordRepository = auditRecordRepository;
        this.governanceExecutor = governanceExecutor;
        this.clock = clock;
        this.auditRetry = auditRetry;
        auditRetry.getEventPublisher().onRetry(e -> log.warn("[AUDIT] Attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : null));
    }

    public void record(AuditEntityType entityType, String entityId, String fromStatus, String toStatus,
            String actor, String reason, Map<String, Object> metadata) {
        record(new AuditEvent(entityType, entityId, fromStatus, toStatus, actor, clock.instant(), reason,
                metadata != null ? metadata : Map.of()));
    }

    public void record(AuditEvent event) {
        try {
            governanceExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.error("[AUDIT] Executor rejected audit event, dropping: {}", event, e);
        }
    }

    /**
     * Audit trail of one entity, oldest first.
     */
    public List<AuditRecord> findByEntityId(String entityId) {
        return auditRecordRepository.findByEntityIdOrderByTimestampAsc(entityId);
    }

    void deliver(AuditEvent event) {
        try {
            auditRetry.executeRunnable(() -> auditSink.record(event));
            log.debug("[AUDIT] {} {} {} -> {} by {}", event.entityType(), event.entityId(),
                    event.fromStatus(), event.toStatus(), event.actor());
        } catch (RuntimeException e) {
            log.error("[AUDIT] Dropped audit event after {} attempts: {}",
                    auditRetry.getRetryConfig().getMaxAttempts(), event, e);
        }
    }
}
