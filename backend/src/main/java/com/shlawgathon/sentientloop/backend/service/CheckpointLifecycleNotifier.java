package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.EscalationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Side effects of a committed checkpoint transition: audit, escalation record
 * closing, events and local waiters. Runs after the compare-and-swap, so
 * nothing here may throw back into the transition.
 */
@Component
public class CheckpointLifecycleNotifier {

    private static final Logger log = LoggerFactory.getLogger(CheckpointLifecycleNotifier.class);

    private final AuditService auditService;
    private final GovernanceEventPublisher eventPublisher;
    private final EscalationRecordRepository escalationRecordRepository;
    private final ResolutionWaiters resolutionWaiters;

    public CheckpointLifecycleNotifier(
            AuditService auditService,
            GovernanceEventPublisher eventPublisher,
            EscalationRecordRepository escalationRecordRepository,
            ResolutionWaiters resolutionWaiters) {
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.escalationRecordRepository = escalationRecordRepository;
        this.resolutionWaiters = resolutionWaiters;
    }

    public void created(Checkpoint checkpoint) {
        auditService.record(AuditEntityType.CHECKPOINT, checkpoint.getId(), null, CheckpointStatus.PENDING.name(),
                checkpoint.getAgentId() != null ? checkpoint.getAgentId() : "system", checkpoint.getGateReason(),
                Map.of("type", checkpoint.getType().name(),
                        "actionType", String.valueOf(checkpoint.getActionType()),
                        "impact", String.valueOf(checkpoint.getImpact())));
        eventPublisher.publish(GovernanceEventType.CHECKPOINT_CREATED, checkpoint.getId(), summary(checkpoint));
    }

    /**
     * A non-terminal move (PENDING and ESCALATED bouncing during a manual
     * escalation).
     */
    public void moved(Checkpoint checkpoint, CheckpointStatus from, String actor, String reason) {
        auditService.record(AuditEntityType.CHECKPOINT, checkpoint.getId(), from.name(),
                checkpoint.getStatus().name(), actor, reason, Map.of());
    }

    public void terminated(Checkpoint checkpoint, CheckpointStatus from, String actor) {
        try {
            long closed = escalationRecordRepository.closeOpenRecords(checkpoint.getId(), checkpoint.getResolvedAt());
            if (closed > 0) {
                log.debug("[CHECKPOINT] Closed {} escalation records of {}", closed, checkpoint.getId());
            }
        } catch (Exception e) {
            log.error("[CHECKPOINT] Failed to close escalation records of {}", checkpoint.getId(), e);
        }

        auditService.record(AuditEntityType.CHECKPOINT, checkpoint.getId(), from.name(),
                checkpoint.getStatus().name(), actor, checkpoint.getResolution(), Map.of());

        Map<String, Object> payload = summary(checkpoint);
        eventPublisher.publish(GovernanceEventType.CHECKPOINT_RESOLVED, checkpoint.getId(), payload);

        if (checkpoint.getStatus().releasesAction()) {
            Map<String, Object> released = new HashMap<>(payload);
            released.put("payload", checkpoint.effectivePayload());
            eventPublisher.publish(GovernanceEventType.ACTION_RELEASED, checkpoint.getId(), released);
            log.info("[CHECKPOINT] {} {} by {}, action {} released", checkpoint.getId(), checkpoint.getStatus(),
                    actor, checkpoint.getActionType());
        } else {
            eventPublisher.publish(GovernanceEventType.ACTION_ABANDONED, checkpoint.getId(), payload);
            log.info("[CHECKPOINT] {} {} by {}, action {} abandoned", checkpoint.getId(), checkpoint.getStatus(),
                    actor, checkpoint.getActionType());
        }

        resolutionWaiters.signal(checkpoint.getId());
    }

    private Map<String, Object> summary(Checkpoint checkpoint) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("checkpointId", checkpoint.getId());
        payload.put("organizationId", checkpoint.getOrganizationId());
        payload.put("status", checkpoint.getStatus().name());
        payload.put("type", checkpoint.getType() != null ? checkpoint.getType().name() : null);
        payload.put("moduleId", checkpoint.getModuleId());
        payload.put("agentId", checkpoint.getAgentId());
        payload.put("actionType", checkpoint.getActionType());
        if (checkpoint.getResolution() != null) {
            payload.put("resolution", checkpoint.getResolution());
        }
        return payload;
    }
}
