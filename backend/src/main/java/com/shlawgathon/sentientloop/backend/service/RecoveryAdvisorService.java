package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.InvalidTransitionException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.exception.RecoveryInProgressException;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import com.shlawgathon.sentientloop.backend.model.RecoveryResult;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.FailureRecordRepository;
import com.shlawgathon.sentientloop.backend.service.RemediationGateway.RemediationOutcome;
import com.shlawgathon.sentientloop.backend.service.recovery.RecoveryOptionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ranks recovery options for a failure and runs the one a human picks.
 * <p>
 * A storage lease on the failure record keeps at most one execution in
 * flight. The remediation call itself runs with no in-process lock held.
 */
@Service
public class RecoveryAdvisorService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryAdvisorService.class);

    private final Map<FailureType, RecoveryOptionProvider> providers = new EnumMap<>(FailureType.class);
    private final FailureRecordRepository failureRecordRepository;
    private final RemediationGateway remediationGateway;
    private final AuditService auditService;
    private final GovernanceEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration leaseDuration;

    public RecoveryAdvisorService(
            List<RecoveryOptionProvider> providers,
            FailureRecordRepository failureRecordRepository,
            RemediationGateway remediationGateway,
            AuditService auditService,
            GovernanceEventPublisher eventPublisher,
            Clock clock,
            @Value("${sentientloop.recovery.lease-seconds:120}") long leaseSeconds) {
        for (RecoveryOptionProvider provider : providers) {
            RecoveryOptionProvider previous = this.providers.put(provider.supports(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two recovery option providers for " + provider.supports() + ": "
                        + previous.getClass().getSimpleName() + ", " + provider.getClass().getSimpleName());
            }
        }
        this.failureRecordRepository = failureRecordRepository;
        this.remediationGateway = remediationGateway;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.leaseDuration = Duration.ofSeconds(leaseSeconds);
    }

    /**
     * Options for an open failure, best first. Exactly the first one is
     * recommended.
     *
     * @throws NotFoundException          unknown failure
     * @throws InvalidTransitionException failure already recovered
     */
    public List<RecoveryOption> proposeOptions(String failureId) {
        FailureRecord failure = failureRecordRepository.findById(failureId)
                .orElseThrow(() -> new NotFoundException("Failure", failureId));
        if (failure.getStatus() == FailureStatus.RECOVERED) {
            throw new InvalidTransitionException(failureId, FailureStatus.RECOVERED.name(), "RECOVERY");
        }
        return rank(optionsFor(failure));
    }

    /**
     * Run the chosen option.
     *
     * @throws RecoveryInProgressException another execution holds the lease
     */
    public RecoveryResult executeRecovery(String failureId, String optionId, String actor) {
        RecoveryOption option = proposeOptions(failureId).stream()
                .filter(o -> o.getId().equals(optionId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Recovery option", optionId));

        String leaseOwner = UUID.randomUUID().toString();
        Instant now = clock.instant();
        FailureRecord leased = failureRecordRepository
                .acquireRecoveryLease(failureId, leaseOwner, now, now.plus(leaseDuration))
                .orElseThrow(() -> leaseUnavailable(failureId));

        log.info("[RECOVERY] {} running {} for {} ({}/{})", actor, option.getAction(), failureId,
                leased.getModuleId(), leased.getOperationName());

        RemediationOutcome outcome;
        if (!option.getAction().requiresRemediationCall()) {
            outcome = RemediationOutcome.succeeded("Marked recovered by " + actor);
        } else {
            try {
                outcome = remediationGateway.execute(leased, option);
            } catch (Exception e) {
                log.warn("[RECOVERY] Remediation for {} failed: {}", failureId, e.getMessage());
                outcome = RemediationOutcome.failed(e.getMessage());
            }
        }

        Instant completedAt = clock.instant();
        FailureRecord updated = outcome.success()
                ? failureRecordRepository.completeRecovery(failureId, leaseOwner, actor, completedAt).orElse(null)
                : failureRecordRepository.failRecovery(failureId, leaseOwner, outcome.message(), completedAt)
                        .orElse(null);
        if (updated == null) {
            // Lease expired mid-call and someone else took over
            log.warn("[RECOVERY] Lease on {} lost before the outcome could be written", failureId);
            updated = failureRecordRepository.findById(failureId).orElse(leased);
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("optionId", option.getId());
        metadata.put("action", option.getAction().name());
        metadata.put("success", outcome.success());
        auditService.record(AuditEntityType.FAILURE, failureId, leased.getStatus().name(),
                updated.getStatus().name(), actor, outcome.message(), metadata);

        if (outcome.success()) {
            log.info("[RECOVERY] {} recovered via {}", failureId, option.getAction());
            Map<String, Object> payload = new HashMap<>(metadata);
            payload.put("failureId", failureId);
            payload.put("moduleId", leased.getModuleId());
            payload.put("operationName", leased.getOperationName());
            eventPublisher.publish(GovernanceEventType.FAILURE_RECOVERED, failureId, payload);
        } else {
            log.info("[RECOVERY] {} via {} failed after {} attempts: {}", failureId, option.getAction(),
                    updated.getRecoveryAttempts(), outcome.message());
        }

        return RecoveryResult.builder()
                .failureId(failureId)
                .optionId(option.getId())
                .action(option.getAction())
                .success(outcome.success())
                .message(outcome.message())
                .failureStatus(updated.getStatus())
                .recoveryAttempts(updated.getRecoveryAttempts())
                .completedAt(completedAt)
                .build();
    }

    private List<RecoveryOption> optionsFor(FailureRecord failure) {
        RecoveryOptionProvider provider = providers.get(failure.getType());
        if (provider == null) {
            return List.of(RecoveryOptionProvider.manualOverride(failure, 0.5));
        }
        return provider.options(failure);
    }

    static List<RecoveryOption> rank(List<RecoveryOption> options) {
        List<RecoveryOption> sorted = new ArrayList<>(options);
        sorted.sort(Comparator.comparingDouble(RecoveryOption::getConfidence).reversed());
        List<RecoveryOption> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).toBuilder().recommended(i == 0).build());
        }
        return ranked;
    }

    private RuntimeException leaseUnavailable(String failureId) {
        FailureRecord current = failureRecordRepository.findById(failureId)
                .orElseThrow(() -> new NotFoundException("Failure", failureId));
        if (current.getStatus() == FailureStatus.RECOVERED) {
            return new InvalidTransitionException(failureId, FailureStatus.RECOVERED.name(), "RECOVERY");
        }
        return new RecoveryInProgressException(failureId);
    }
}
