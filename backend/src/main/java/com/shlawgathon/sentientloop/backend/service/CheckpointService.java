package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.GateDecision;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Service
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final CheckpointRepository checkpointRepository;
    private final EscalationService escalationService;
    private final CheckpointLifecycleNotifier lifecycleNotifier;
    private final ResolutionWaiters resolutionWaiters;
    private final Clock clock;

    public CheckpointService(
            CheckpointRepository checkpointRepository,
            EscalationService escalationService,
            CheckpointLifecycleNotifier lifecycleNotifier,
            ResolutionWaiters resolutionWaiters,
            Clock clock) {
        this.checkpointRepository = checkpointRepository;
        this.escalationService = escalationService;
        this.lifecycleNotifier = lifecycleNotifier;
        this.resolutionWaiters = resolutionWaiters;
        this.clock = clock;
    }

    /**
     * Suspend a proposed action behind a new PENDING checkpoint.
     */
    public Checkpoint create(ProposedAction action, GateDecision decision, PolicyConfig policy) {
        Checkpoint checkpoint = checkpointRepository.insert(Checkpoint.builder()
                .organizationId(policy.getOrganizationId())
                .type(decision.checkpointType())
                .status(CheckpointStatus.PENDING)
                .moduleId(action.getModuleId())
                .agentId(action.getAgentId())
                .actionType(action.getActionType())
                .title(action.getTitle() != null ? action.getTitle() : action.getActionType())
                .description(action.getDescription())
                .originalPayload(action.getPayload() != null ? new HashMap<>(action.getPayload()) : new HashMap<>())
                .confidence(action.getConfidence())
                .impact(action.getImpact())
                .gateReason(decision.reason())
                .parentCheckpointId(action.getParentCheckpointId())
                .createdAt(clock.instant())
                .build());

        log.info("[CHECKPOINT] Created {} ({}) for {} in {}: {}", checkpoint.getId(), checkpoint.getType(),
                checkpoint.getActionType(), checkpoint.getModuleId(), decision.reason());
        lifecycleNotifier.created(checkpoint);

        if (checkpoint.getImpact() == ImpactLevel.CRITICAL) {
            try {
                escalationService.escalateOnCreate(checkpoint, policy);
            } catch (Exception e) {
                // The sweep escalates it later
                log.error("[ESCALATION] Immediate escalation of critical checkpoint {} failed",
                        checkpoint.getId(), e);
            }
        }
        return checkpoint;
    }

    public Checkpoint getCheckpoint(String id) {
        return checkpointRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Checkpoint", id));
    }

    public List<Checkpoint> getPendingCheckpoints(CheckpointFilter filter) {
        return checkpointRepository.findPending(filter != null ? filter : CheckpointFilter.all());
    }

    /**
     * Completes with the checkpoint once it reaches a terminal state, or with
     * its current snapshot when {@code timeout} elapses first. Cancelling or
     * abandoning the future leaves the checkpoint alone.
     */
    public CompletableFuture<Checkpoint> awaitResolution(String id, Duration timeout) {
        Checkpoint current = getCheckpoint(id);
        if (current.getStatus().isTerminal()) {
            return CompletableFuture.completedFuture(current);
        }

        CompletableFuture<Void> signal = resolutionWaiters.register(id);
        // Resolved between the read and the registration
        Checkpoint recheck = getCheckpoint(id);
        if (recheck.getStatus().isTerminal()) {
            signal.complete(null);
            return CompletableFuture.completedFuture(recheck);
        }

        return signal
                .completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(v -> getCheckpoint(id));
    }
}
