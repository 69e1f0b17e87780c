package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.MemoryRetention;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import com.shlawgathon.sentientloop.backend.repository.EscalationRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.FailureRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.PolicyConfigRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Purges governance data past the organization's retention windows.
 * <ul>
 * <li>terminal checkpoints: {@code criticalDecisionDays} for CRITICAL impact,
 * {@code longTermDays} otherwise, together with their escalation records</li>
 * <li>recovered failures: {@code shortTermDays}</li>
 * <li>audit records: {@code auditTrailDays}</li>
 * </ul>
 * Failures and audit records carry no organization, so they use the longest
 * window any organization configures. A checkpoint whose follow-ups are still
 * open is kept: its id roots their escalation chain.
 */
@Service
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private static final List<CheckpointStatus> TERMINAL = List.of(CheckpointStatus.APPROVED,
            CheckpointStatus.REJECTED, CheckpointStatus.MODIFIED, CheckpointStatus.EXPIRED);

    private static final int MAX_CHAIN_DEPTH = 64;

    private final PolicyConfigRepository policyConfigRepository;
    private final CheckpointRepository checkpointRepository;
    private final EscalationRecordRepository escalationRecordRepository;
    private final FailureRecordRepository failureRecordRepository;
    private final AuditRecordRepository auditRecordRepository;
    private final Clock clock;
    private final boolean enabled;
    private final long intervalHours;

    private ScheduledExecutorService scheduler;

    public RetentionService(
            PolicyConfigRepository policyConfigRepository,
            CheckpointRepository checkpointRepository,
            EscalationRecordRepository escalationRecordRepository,
            FailureRecordRepository failureRecordRepository,
            AuditRecordRepository auditRecordRepository,
            Clock clock,
            @Value("${sentientloop.retention.enabled:true}") boolean enabled,
            @Value("${sentientloop.retention.interval-hours:24}") long intervalHours) {
        this.policyConfigRepository = policyConfigRepository;
        this.checkpointRepository = checkpointRepository;
        this.escalationRecordRepository = escalationRecordRepository;
        this.failureRecordRepository = failureRecordRepository;
        this.auditRecordRepository = auditRecordRepository;
        this.clock = clock;
        this.enabled = enabled;
        this.intervalHours = intervalHours;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("[RETENTION] Retention sweep disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-sweep");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                purge(clock.instant());
            } catch (Exception e) {
                log.error("[RETENTION] Sweep failed", e);
            }
        }, intervalHours, intervalHours, TimeUnit.HOURS);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    public RetentionSummary purge(Instant now) {
        List<PolicyConfig> policies = policyConfigRepository.findAll();
        if (policies.isEmpty()) {
            policies = List.of(PolicyService.defaults(PolicyService.DEFAULT_ORGANIZATION));
        }

        long checkpoints = 0;
        long escalations = 0;
        int longestShortTerm = 0;
        int longestAuditTrail = 0;
        for (PolicyConfig policy : policies) {
            MemoryRetention retention = policy.getMemoryRetention() != null
                    ? policy.getMemoryRetention()
                    : new MemoryRetention();
            longestShortTerm = Math.max(longestShortTerm, retention.getShortTermDays());
            longestAuditTrail = Math.max(longestAuditTrail, retention.getAuditTrailDays());

            Instant longTermCutoff = now.minus(Duration.ofDays(retention.getLongTermDays()));
            Instant criticalCutoff = now.minus(Duration.ofDays(retention.getCriticalDecisionDays()));
            List<Checkpoint> expired = checkpointRepository
                    .findByOrganizationIdAndStatusInAndResolvedAtBefore(policy.getOrganizationId(), TERMINAL,
                            longTermCutoff)
                    .stream()
                    .filter(c -> c.getImpact() != ImpactLevel.CRITICAL || c.getResolvedAt().isBefore(criticalCutoff))
                    .filter(c -> {
                        if (hasOpenDescendant(c)) {
                            log.debug("[RETENTION] Keeping {}: a follow-up is still open", c.getId());
                            return false;
                        }
                        return true;
                    })
                    .toList();
            if (!expired.isEmpty()) {
                escalations += escalationRecordRepository.deleteByCheckpointIdIn(
                        expired.stream().map(Checkpoint::getId).toList());
                checkpointRepository.deleteAll(expired);
                checkpoints += expired.size();
            }
        }

        long failures = failureRecordRepository.deleteByStatusAndRecoveredAtBefore(FailureStatus.RECOVERED,
                now.minus(Duration.ofDays(longestShortTerm)));
        long audits = auditRecordRepository.deleteByTimestampBefore(now.minus(Duration.ofDays(longestAuditTrail)));

        RetentionSummary summary = new RetentionSummary(checkpoints, escalations, failures, audits);
        log.info("[RETENTION] Purged {}", summary);
        return summary;
    }

    boolean hasOpenDescendant(Checkpoint checkpoint) {
        Deque<String> frontier = new ArrayDeque<>(List.of(checkpoint.getId()));
        Set<String> visited = new HashSet<>(frontier);
        int depth = 0;
        while (!frontier.isEmpty() && depth++ < MAX_CHAIN_DEPTH) {
            Deque<String> next = new ArrayDeque<>();
            for (String parentId : frontier) {
                for (Checkpoint child : checkpointRepository.findByParentCheckpointId(parentId)) {
                    if (!child.getStatus().isTerminal()) {
                        return true;
                    }
                    if (visited.add(child.getId())) {
                        next.add(child.getId());
                    }
                }
            }
            frontier = next;
        }
        return false;
    }

    public record RetentionSummary(long checkpoints, long escalationRecords, long failures, long auditRecords) {
    }
}
