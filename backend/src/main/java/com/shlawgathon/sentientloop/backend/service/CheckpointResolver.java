package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.AlreadyResolvedException;
import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.InvalidTransitionException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Human resolution of checkpoints.
 * <p>
 * Every resolution is a compare-and-swap on {@code status == PENDING} in
 * Mongo, so of two racing resolvers exactly one wins and the other gets
 * {@link AlreadyResolvedException} with the state the winner left behind.
 */
@Service
public class CheckpointResolver {

    private static final Logger log = LoggerFactory.getLogger(CheckpointResolver.class);

    private final CheckpointRepository checkpointRepository;
    private final EscalationService escalationService;
    private final PolicyService policyService;
    private final CheckpointLifecycleNotifier lifecycleNotifier;
    private final Clock clock;

    public CheckpointResolver(
            CheckpointRepository checkpointRepository,
            EscalationService escalationService,
            PolicyService policyService,
            CheckpointLifecycleNotifier lifecycleNotifier,
            Clock clock) {
        this.checkpointRepository = checkpointRepository;
        this.escalationService = escalationService;
        this.policyService = policyService;
        this.lifecycleNotifier = lifecycleNotifier;
        this.clock = clock;
    }

    /**
     * Move a PENDING checkpoint to {@code target}.
     *
     * @param reason          required for everything but APPROVED
     * @param modifiedPayload required for MODIFIED, ignored otherwise
     * @param level           required for ESCALATED, ignored otherwise
     * @throws NotFoundException             unknown checkpoint
     * @throws InvalidTransitionException    target is not a human-resolvable
     *                                       state, or the checkpoint is
     *                                       mid-escalation
     * @throws AlreadyResolvedException      the checkpoint is no longer PENDING
     * @throws GovernanceValidationException missing reason or payload
     */
    public Checkpoint resolve(String checkpointId, CheckpointStatus target, String reason,
            Map<String, Object> modifiedPayload, ImpactLevel level, String actor) {
        Checkpoint current = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));

        if (target == null || !target.isHumanResolvable()) {
            throw new InvalidTransitionException(checkpointId, current.getStatus().name(), String.valueOf(target));
        }
        if (current.getStatus().isTerminal()) {
            throw new AlreadyResolvedException(current, target);
        }
        if (!current.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(checkpointId, current.getStatus().name(), target.name());
        }

        if (target == CheckpointStatus.ESCALATED) {
            return escalationService.escalateManually(checkpointId, level, reason, actor,
                    policyService.getPolicy(current.getOrganizationId()));
        }

        validate(target, reason, modifiedPayload);

        Update fields = new Update()
                .set("resolvedAt", clock.instant())
                .set("resolvedBy", actor)
                .set("resolution", reason);
        if (target == CheckpointStatus.MODIFIED) {
            fields.set("modifiedPayload", new HashMap<>(modifiedPayload));
        }

        Checkpoint resolved = checkpointRepository.compareAndSetStatus(checkpointId, CheckpointStatus.PENDING,
                target, fields)
                .orElseThrow(() -> lostRace(checkpointId, target));

        log.info("[CHECKPOINT] {} resolved {} by {}", checkpointId, target, actor);
        lifecycleNotifier.terminated(resolved, CheckpointStatus.PENDING, actor);
        return resolved;
    }

    private static void validate(CheckpointStatus target, String reason, Map<String, Object> modifiedPayload) {
        boolean reasonMissing = reason == null || reason.isBlank();
        if (target == CheckpointStatus.REJECTED && reasonMissing) {
            throw new GovernanceValidationException("A reason is required to reject");
        }
        if (target == CheckpointStatus.MODIFIED) {
            if (reasonMissing) {
                throw new GovernanceValidationException("A reason is required to modify");
            }
            if (modifiedPayload == null || modifiedPayload.isEmpty()) {
                throw new GovernanceValidationException("A non-empty modifiedPayload is required to modify");
            }
        }
    }

    private AlreadyResolvedException lostRace(String checkpointId, CheckpointStatus requested) {
        Checkpoint current = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        log.info("[CHECKPOINT] {} lost resolution race: requested {}, already {}", checkpointId, requested,
                current.getStatus());
        return new AlreadyResolvedException(current, requested);
    }
}
