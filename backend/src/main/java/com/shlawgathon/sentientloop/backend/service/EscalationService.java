package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.AlreadyResolvedException;
import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import com.shlawgathon.sentientloop.backend.repository.EscalationRecordRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * The escalation ladder.
 * <p>
 * A chain is a checkpoint plus its {@code parentCheckpointId} ancestors. Its
 * records all share the root's id and are numbered by rung, starting at 0.
 * Rung n notifies {@code criticalEscalationPath[n]} (or {@code notifyUsers}
 * when the policy has no path). Levels never go down: the first escalation
 * lands on the policy's {@code autoEscalateThreshold}, every later one a step
 * above the highest level the chain has reached, holding at CRITICAL.
 * <p>
 * The ladder has one rung per path entry. A checkpoint expires only once
 * every rung has been climbed and another timeout window has passed.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    static final String SYSTEM_ACTOR = "system";

    private static final int MAX_CHAIN_DEPTH = 64;

    private final CheckpointRepository checkpointRepository;
    private final EscalationRecordRepository escalationRecordRepository;
    private final NotificationGateway notificationGateway;
    private final CheckpointLifecycleNotifier lifecycleNotifier;
    private final AuditService auditService;
    private final GovernanceEventPublisher eventPublisher;
    private final Executor governanceExecutor;
    private final Clock clock;
    private final Retry notificationRetry;

    public EscalationService(
            CheckpointRepository checkpointRepository,
            EscalationRecordRepository escalationRecordRepository,
            NotificationGateway notificationGateway,
            CheckpointLifecycleNotifier lifecycleNotifier,
            AuditService auditService,
            GovernanceEventPublisher eventPublisher,
            @Qualifier("governanceExecutor") Executor governanceExecutor,
            Clock clock,
            @Qualifier("notificationRetry") Retry notificationRetry) {
        this.checkpointRepository = checkpointRepository;
        this.escalationRecordRepository = escalationRecordRepository;
        this.notificationGateway = notificationGateway;
        this.lifecycleNotifier = lifecycleNotifier;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.governanceExecutor = governanceExecutor;
        this.clock = clock;
        this.notificationRetry = notificationRetry;
        notificationRetry.getEventPublisher().onRetry(e -> log.warn("[NOTIFY] Attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : null));
    }

    /**
     * Escalate one overdue checkpoint, or expire it once the ladder is
     * exhausted and another timeout window has passed.
     */
    public EscalationOutcome escalateIfDue(Checkpoint checkpoint, PolicyConfig policy, Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(policy.getEscalationTimeoutMinutes()));
        String rootId = rootOf(checkpoint);
        List<EscalationRecord> chain = escalationRecordRepository.findByRootCheckpointIdOrderByCreatedAtAsc(rootId);
        ImpactLevel highest = highestLevel(chain);
        int rung = chain.size();

        if (rung >= ladderLength(policy)) {
            return checkpointRepository.expireIfStale(checkpoint.getId(), cutoff,
                    "Escalation ladder exhausted without resolution", now)
                    .map(expired -> {
                        log.warn("[ESCALATION] {} expired after {} rungs unresolved", expired.getId(), rung);
                        lifecycleNotifier.terminated(expired, CheckpointStatus.PENDING, SYSTEM_ACTOR);
                        return EscalationOutcome.EXPIRED;
                    })
                    .orElse(EscalationOutcome.SKIPPED);
        }

        ImpactLevel level = highest == null
                ? policy.getAutoEscalateThreshold()
                : highest.next().orElse(ImpactLevel.CRITICAL);
        Optional<Checkpoint> claimed = checkpointRepository.advanceEscalationWatermark(checkpoint.getId(), cutoff,
                level, now);
        if (claimed.isEmpty()) {
            log.debug("[ESCALATION] {} already escalated or resolved, skipping", checkpoint.getId());
            return EscalationOutcome.SKIPPED;
        }

        List<String> parties = recipientsFor(rung, policy);
        String reason = "Unresolved for more than " + policy.getEscalationTimeoutMinutes() + " minutes";
        EscalationRecord record = insertRecord(claimed.get(), rootId, rung, level, reason, parties, SYSTEM_ACTOR,
                now);
        auditService.record(AuditEntityType.ESCALATION, claimed.get().getId(),
                highest != null ? highest.name() : null, level.name(), SYSTEM_ACTOR, reason,
                Map.of("escalationRecordId", record.getId(), "notifiedParties", parties));
        announce(claimed.get(), record);
        return EscalationOutcome.ESCALATED;
    }

    /**
     * Escalation a CRITICAL impact checkpoint gets the moment it is created:
     * the whole critical path hears about it at once. This is rung 0; later
     * sweeps still walk the remaining rungs one timeout window apart.
     */
    public void escalateOnCreate(Checkpoint checkpoint, PolicyConfig policy) {
        Instant now = clock.instant();
        Optional<Checkpoint> claimed = checkpointRepository.advanceEscalationWatermark(checkpoint.getId(), now,
                ImpactLevel.CRITICAL, now);
        if (claimed.isEmpty()) {
            return;
        }
        List<String> parties = policy.getCriticalEscalationPath() != null && !policy.getCriticalEscalationPath().isEmpty()
                ? List.copyOf(policy.getCriticalEscalationPath())
                : notifyUsersOf(policy);
        String reason = "Critical impact action requires immediate attention";
        String rootId = rootOf(checkpoint);
        int rung = escalationRecordRepository.findByRootCheckpointIdOrderByCreatedAtAsc(rootId).size();
        EscalationRecord record = insertRecord(claimed.get(), rootId, rung, ImpactLevel.CRITICAL, reason,
                parties, SYSTEM_ACTOR, now);
        auditService.record(AuditEntityType.ESCALATION, checkpoint.getId(), null, ImpactLevel.CRITICAL.name(),
                SYSTEM_ACTOR, reason, Map.of("escalationRecordId", record.getId()));
        announce(claimed.get(), record);
    }

    /**
     * Human-requested escalation. Walks PENDING -> ESCALATED -> PENDING, so the
     * checkpoint stays resolvable at the new tier.
     *
     * @throws GovernanceValidationException when the reason is missing or the
     *                                       level would lower the chain
     * @throws AlreadyResolvedException      when the checkpoint left PENDING
     */
    public Checkpoint escalateManually(String checkpointId, ImpactLevel targetLevel, String reason, String actor,
            PolicyConfig policy) {
        if (reason == null || reason.isBlank()) {
            throw new GovernanceValidationException("A reason is required to escalate");
        }
        if (targetLevel == null) {
            throw new GovernanceValidationException("A target level is required to escalate");
        }
        Checkpoint current = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        String rootId = rootOf(current);
        List<EscalationRecord> chain = escalationRecordRepository.findByRootCheckpointIdOrderByCreatedAtAsc(rootId);
        ImpactLevel highest = highestLevel(chain);
        if (highest != null && targetLevel.compareTo(highest) < 0) {
            throw new GovernanceValidationException(
                    "Escalation level " + targetLevel + " is below the chain's current level " + highest);
        }

        Checkpoint escalated = checkpointRepository.compareAndSetStatus(checkpointId, CheckpointStatus.PENDING,
                CheckpointStatus.ESCALATED, null)
                .orElseThrow(() -> alreadyResolved(checkpointId, CheckpointStatus.ESCALATED));
        lifecycleNotifier.moved(escalated, CheckpointStatus.PENDING, actor, reason);

        Instant now = clock.instant();
        EscalationRecord record = null;
        try {
            List<String> parties = recipientsFor(chain.size(), policy);
            record = insertRecord(escalated, rootId, chain.size(), targetLevel, reason, parties, actor, now);
        } finally {
            // Re-open at the new tier even if the record could not be written
            Update reopen = new Update()
                    .set("escalationLevel", ImpactLevel.max(targetLevel, escalated.getEscalationLevel()))
                    .set("lastEscalatedAt", now)
                    .inc("escalationCount", 1);
            Optional<Checkpoint> reopened = checkpointRepository.compareAndSetStatus(checkpointId,
                    CheckpointStatus.ESCALATED, CheckpointStatus.PENDING, reopen);
            reopened.ifPresent(c -> lifecycleNotifier.moved(c, CheckpointStatus.ESCALATED, actor,
                    "Re-opened at " + targetLevel));
            if (reopened.isEmpty()) {
                log.warn("[ESCALATION] {} left ESCALATED before it could be re-opened", checkpointId);
            }
        }

        auditService.record(AuditEntityType.ESCALATION, checkpointId,
                highest != null ? highest.name() : null, targetLevel.name(), actor, reason,
                Map.of("escalationRecordId", record.getId()));
        Checkpoint result = checkpointRepository.findById(checkpointId).orElse(escalated);
        announce(result, record);
        return result;
    }

    public List<EscalationRecord> chainRecords(String checkpointId) {
        Checkpoint checkpoint = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        return escalationRecordRepository.findByRootCheckpointIdOrderByCreatedAtAsc(rootOf(checkpoint));
    }

    /**
     * Root of the chain, following parent pointers. Missing parents and cycles
     * end the walk.
     */
    public String rootOf(Checkpoint checkpoint) {
        String rootId = checkpoint.getId();
        String parentId = checkpoint.getParentCheckpointId();
        Set<String> visited = new HashSet<>();
        visited.add(rootId);
        int depth = 0;
        while (parentId != null && visited.add(parentId) && depth++ < MAX_CHAIN_DEPTH) {
            Optional<Checkpoint> parent = checkpointRepository.findById(parentId);
            if (parent.isEmpty()) {
                break;
            }
            rootId = parentId;
            parentId = parent.get().getParentCheckpointId();
        }
        return rootId;
    }

    static int ladderLength(PolicyConfig policy) {
        List<String> path = policy.getCriticalEscalationPath();
        return path == null || path.isEmpty() ? 1 : path.size();
    }

    List<String> recipientsFor(int rung, PolicyConfig policy) {
        List<String> path = policy.getCriticalEscalationPath();
        if (path != null && rung < path.size()) {
            return List.of(path.get(rung));
        }
        return notifyUsersOf(policy);
    }

    private static List<String> notifyUsersOf(PolicyConfig policy) {
        return policy.getNotifyUsers() != null ? List.copyOf(policy.getNotifyUsers()) : List.of();
    }

    private static ImpactLevel highestLevel(List<EscalationRecord> chain) {
        ImpactLevel highest = null;
        for (EscalationRecord record : chain) {
            highest = ImpactLevel.max(highest, record.getLevel());
        }
        return highest;
    }

    private EscalationRecord insertRecord(Checkpoint checkpoint, String rootId, int rung, ImpactLevel level,
            String reason, List<String> parties, String triggeredBy, Instant now) {
        EscalationRecord record = escalationRecordRepository.insert(EscalationRecord.builder()
                .checkpointId(checkpoint.getId())
                .rootCheckpointId(rootId)
                .rung(rung)
                .level(level)
                .reason(reason)
                .notifiedParties(new ArrayList<>(parties))
                .triggeredBy(triggeredBy)
                .createdAt(now)
                .build());
        log.info("[ESCALATION] {} escalated to {} (rung {}) by {}, notifying {}", checkpoint.getId(), level, rung,
                triggeredBy, parties);
        return record;
    }

    private void announce(Checkpoint checkpoint, EscalationRecord record) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("checkpointId", checkpoint.getId());
        payload.put("escalationRecordId", record.getId());
        payload.put("level", record.getLevel().name());
        payload.put("rung", record.getRung());
        payload.put("notifiedParties", record.getNotifiedParties());
        payload.put("reason", record.getReason());
        eventPublisher.publish(GovernanceEventType.ESCALATION_CREATED, checkpoint.getId(), payload);

        Map<String, Object> context = new HashMap<>(payload);
        context.put("title", checkpoint.getTitle());
        context.put("organizationId", checkpoint.getOrganizationId());
        String subject = "Checkpoint escalated to " + record.getLevel() + ": "
                + (checkpoint.getTitle() != null ? checkpoint.getTitle() : checkpoint.getId());
        String idempotencyKey = idempotencyKey(checkpoint.getId(), record);
        dispatchNotification(record.getNotifiedParties(), subject, context, idempotencyKey);
    }

    private void dispatchNotification(List<String> parties, String subject, Map<String, Object> context,
            String idempotencyKey) {
        if (parties == null || parties.isEmpty()) {
            log.warn("[NOTIFY] No recipients for {}", idempotencyKey);
            return;
        }
        try {
            governanceExecutor.execute(() -> {
                try {
                    notificationRetry.executeSupplier(
                            () -> notificationGateway.notify(parties, subject, context, idempotencyKey));
                } catch (RuntimeException e) {
                    log.error("[NOTIFY] Gave up notifying {} about {} after {} attempts", parties, idempotencyKey,
                            notificationRetry.getRetryConfig().getMaxAttempts(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[NOTIFY] Executor rejected notification {}", idempotencyKey, e);
        }
    }

    /**
     * One key per rung, so a repeated CRITICAL rung still reaches its own
     * recipients while a replay of the same rung is deduplicated.
     */
    static String idempotencyKey(String checkpointId, EscalationRecord record) {
        return checkpointId + ":" + record.getLevel().name() + ":" + record.getRung();
    }

    private AlreadyResolvedException alreadyResolved(String checkpointId, CheckpointStatus requested) {
        Checkpoint current = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        return new AlreadyResolvedException(current, requested);
    }
}
