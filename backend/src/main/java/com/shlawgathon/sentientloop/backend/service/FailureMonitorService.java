package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStats;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.FailureRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Failure catalogue. Repeated failures of one operation collapse into the
 * single open record for that (operationName, moduleId) pair.
 */
@Service
public class FailureMonitorService {

    private static final Logger log = LoggerFactory.getLogger(FailureMonitorService.class);

    static final List<FailureStatus> OPEN_STATUSES = List.of(FailureStatus.ACTIVE, FailureStatus.ACKNOWLEDGED);

    private final FailureRecordRepository failureRecordRepository;
    private final AuditService auditService;
    private final GovernanceEventPublisher eventPublisher;
    private final Clock clock;

    public FailureMonitorService(
            FailureRecordRepository failureRecordRepository,
            AuditService auditService,
            GovernanceEventPublisher eventPublisher,
            Clock clock) {
        this.failureRecordRepository = failureRecordRepository;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public FailureRecord report(String operationName, String moduleId, FailureType type,
            Map<String, Object> metadata, String errorMessage) {
        if (operationName == null || operationName.isBlank()) {
            throw new GovernanceValidationException("operationName is required");
        }
        if (moduleId == null || moduleId.isBlank()) {
            throw new GovernanceValidationException("moduleId is required");
        }
        if (type == null) {
            throw new GovernanceValidationException("type is required");
        }

        FailureRecord record = failureRecordRepository.upsertOpenFailure(operationName, moduleId, type, metadata,
                errorMessage, clock.instant());

        if (record.getRecoveryAttempts() == 1) {
            log.warn("[FAILURE] New {} failure {} in {}/{}: {}", type, record.getId(), moduleId, operationName,
                    errorMessage);
            auditService.record(AuditEntityType.FAILURE, record.getId(), null, FailureStatus.ACTIVE.name(),
                    moduleId, errorMessage, Map.of("operationName", operationName, "type", type.name()));
        } else {
            log.info("[FAILURE] {}/{} failed again ({} occurrences)", moduleId, operationName,
                    record.getRecoveryAttempts());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("failureId", record.getId());
        payload.put("operationName", operationName);
        payload.put("moduleId", moduleId);
        payload.put("type", record.getType().name());
        payload.put("recoveryAttempts", record.getRecoveryAttempts());
        eventPublisher.publish(GovernanceEventType.FAILURE_REPORTED, record.getId(), payload);
        return record;
    }

    /**
     * ACTIVE -> ACKNOWLEDGED. Acknowledging twice is a no-op.
     *
     * @throws NotFoundException when the failure is unknown or already recovered
     */
    public FailureRecord acknowledge(String failureId, String actor) {
        return failureRecordRepository.acknowledge(failureId, actor, clock.instant())
                .map(acknowledged -> {
                    log.info("[FAILURE] {} acknowledged by {}", failureId, actor);
                    auditService.record(AuditEntityType.FAILURE, failureId, FailureStatus.ACTIVE.name(),
                            FailureStatus.ACKNOWLEDGED.name(), actor, null, Map.of());
                    return acknowledged;
                })
                .orElseGet(() -> failureRecordRepository.findById(failureId)
                        .filter(existing -> existing.getStatus() == FailureStatus.ACKNOWLEDGED)
                        .orElseThrow(() -> new NotFoundException("Active failure", failureId)));
    }

    public List<FailureRecord> listActiveFailures(String moduleId) {
        if (moduleId == null || moduleId.isBlank()) {
            return failureRecordRepository.findByStatusInOrderByLastRecoveryAttemptDesc(OPEN_STATUSES);
        }
        return failureRecordRepository.findByModuleIdAndStatusInOrderByLastRecoveryAttemptDesc(moduleId,
                OPEN_STATUSES);
    }

    public FailureRecord getFailure(String failureId) {
        return failureRecordRepository.findById(failureId)
                .orElseThrow(() -> new NotFoundException("Failure", failureId));
    }

    public FailureStats getStats() {
        Map<FailureType, Long> byType = new EnumMap<>(FailureType.class);
        for (FailureType type : FailureType.values()) {
            byType.put(type, failureRecordRepository.countByType(type));
        }
        return new FailureStats(
                failureRecordRepository.count(),
                failureRecordRepository.countByStatus(FailureStatus.ACTIVE),
                failureRecordRepository.countByStatus(FailureStatus.ACKNOWLEDGED),
                failureRecordRepository.countByStatus(FailureStatus.RECOVERED),
                byType,
                failureRecordRepository.countOpenByModule());
    }
}
