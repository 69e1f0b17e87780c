package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sweep that escalates checkpoints left PENDING past their
 * organization's timeout.
 *
 * <p>
 * Runs on its own daemon thread. Each organization is swept under its own
 * non-reentrant flag: a sweep that finds the flag taken (a slow previous run,
 * or a manual sweep) skips that organization instead of waiting. Correctness
 * across pods comes from the conditional watermark update, not from the flag.
 */
@Component
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final CheckpointRepository checkpointRepository;
    private final PolicyService policyService;
    private final EscalationService escalationService;
    private final Clock clock;
    private final boolean enabled;
    private final long intervalSeconds;

    private final Map<String, AtomicBoolean> scopeGuards = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    public EscalationScheduler(
            CheckpointRepository checkpointRepository,
            PolicyService policyService,
            EscalationService escalationService,
            Clock clock,
            @Value("${sentientloop.escalation.enabled:true}") boolean enabled,
            @Value("${sentientloop.escalation.sweep-interval-seconds:60}") long intervalSeconds) {
        this.checkpointRepository = checkpointRepository;
        this.policyService = policyService;
        this.escalationService = escalationService;
        this.clock = clock;
        this.enabled = enabled;
        this.intervalSeconds = intervalSeconds;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("[ESCALATION] Scheduled sweep disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "escalation-sweep");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("[ESCALATION] Sweeping every {}s", intervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    void tick() {
        try {
            SweepSummary summary = sweep(clock.instant());
            if (summary.escalated() > 0 || summary.expired() > 0) {
                log.info("[ESCALATION] Sweep done: {}", summary);
            }
        } catch (Exception e) {
            // Keep the schedule alive
            log.error("[ESCALATION] Sweep failed", e);
        }
    }

    /**
     * Sweep every organization that has pending checkpoints. An organization
     * whose sweep throws counts as skipped.
     */
    public SweepSummary sweep(Instant now) {
        SweepSummary total = SweepSummary.empty();
        for (String organizationId : checkpointRepository.findPendingOrganizations()) {
            try {
                total = total.plus(sweepScope(organizationId, now));
            } catch (Exception e) {
                // One broken organization must not starve the rest
                log.error("[ESCALATION] Sweep of {} failed, moving on", organizationId, e);
                total = total.plus(new SweepSummary(1, 1, 0, 0));
            }
        }
        return total;
    }

    SweepSummary sweepScope(String organizationId, Instant now) {
        AtomicBoolean guard = scopeGuards.computeIfAbsent(organizationId, k -> new AtomicBoolean(false));
        if (!guard.compareAndSet(false, true)) {
            log.debug("[ESCALATION] Sweep of {} still running, skipping", organizationId);
            return new SweepSummary(1, 1, 0, 0);
        }
        try {
            PolicyConfig policy = policyService.getPolicy(organizationId);
            if (!policy.isActive()) {
                return new SweepSummary(1, 0, 0, 0);
            }
            Instant cutoff = now.minus(Duration.ofMinutes(policy.getEscalationTimeoutMinutes()));
            List<Checkpoint> candidates = checkpointRepository.findEscalationCandidates(organizationId, cutoff);
            int escalated = 0;
            int expired = 0;
            for (Checkpoint checkpoint : candidates) {
                try {
                    EscalationOutcome outcome = escalationService.escalateIfDue(checkpoint, policy, now);
                    if (outcome == EscalationOutcome.ESCALATED) {
                        escalated++;
                    } else if (outcome == EscalationOutcome.EXPIRED) {
                        expired++;
                    }
                } catch (Exception e) {
                    log.error("[ESCALATION] Failed to escalate {}", checkpoint.getId(), e);
                }
            }
            return new SweepSummary(1, 0, escalated, expired);
        } finally {
            guard.set(false);
        }
    }
}
