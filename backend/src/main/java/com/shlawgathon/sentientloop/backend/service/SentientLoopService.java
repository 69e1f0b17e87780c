package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStats;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.GateDecision;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.model.ProposalResult;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import com.shlawgathon.sentientloop.backend.model.RecoveryResult;
import com.shlawgathon.sentientloop.backend.model.ResolutionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for agents, resolvers and operators. Controllers talk to this
 * facade only.
 */
@Service
public class SentientLoopService {

    private static final Logger log = LoggerFactory.getLogger(SentientLoopService.class);

    private final PolicyService policyService;
    private final CheckpointGate checkpointGate;
    private final CheckpointService checkpointService;
    private final CheckpointResolver checkpointResolver;
    private final EscalationService escalationService;
    private final EscalationScheduler escalationScheduler;
    private final FailureMonitorService failureMonitorService;
    private final RecoveryAdvisorService recoveryAdvisorService;
    private final AuditService auditService;
    private final Clock clock;

    public SentientLoopService(
            PolicyService policyService,
            CheckpointGate checkpointGate,
            CheckpointService checkpointService,
            CheckpointResolver checkpointResolver,
            EscalationService escalationService,
            EscalationScheduler escalationScheduler,
            FailureMonitorService failureMonitorService,
            RecoveryAdvisorService recoveryAdvisorService,
            AuditService auditService,
            Clock clock) {
        this.policyService = policyService;
        this.checkpointGate = checkpointGate;
        this.checkpointService = checkpointService;
        this.checkpointResolver = checkpointResolver;
        this.escalationService = escalationService;
        this.escalationScheduler = escalationScheduler;
        this.failureMonitorService = failureMonitorService;
        this.recoveryAdvisorService = recoveryAdvisorService;
        this.auditService = auditService;
        this.clock = clock;
    }

    // Checkpoints

    public ProposalResult proposeAction(ProposedAction action) {
        if (action == null || action.getActionType() == null || action.getActionType().isBlank()) {
            throw new GovernanceValidationException("actionType is required");
        }
        if (Double.isNaN(action.getConfidence()) || action.getConfidence() < 0.0 || action.getConfidence() > 1.0) {
            throw new GovernanceValidationException("confidence must be between 0 and 1");
        }
        if (action.getImpact() == null) {
            action.setImpact(ImpactLevel.MEDIUM);
        }
        action.setOrganizationId(PolicyService.normalizeOrganization(action.getOrganizationId()));

        PolicyConfig policy = policyService.getPolicy(action.getOrganizationId());
        GateDecision decision = checkpointGate.evaluate(action, policy);

        if (decision.checkpointRequired()) {
            log.info("[GATE] {} from {} needs {}: {}", action.getActionType(), action.getAgentId(),
                    decision.checkpointType(), decision.reason());
            Checkpoint checkpoint = checkpointService.create(action, decision, policy);
            return new ProposalResult(decision, checkpoint, policy.getVersion());
        }

        log.info("[GATE] {} from {} proceeds{}: {}", action.getActionType(), action.getAgentId(),
                decision.policyDisabled() ? " (governance disabled)" : "", decision.reason());
        Map<String, Object> trace = new HashMap<>();
        trace.put("organizationId", action.getOrganizationId());
        trace.put("moduleId", action.getModuleId());
        trace.put("agentId", action.getAgentId());
        trace.put("confidence", action.getConfidence());
        trace.put("impact", action.getImpact().name());
        trace.put("policyVersion", policy.getVersion());
        auditService.record(AuditEntityType.ACTION, action.getActionType(), null,
                decision.policyDisabled() ? "POLICY_DISABLED" : "PROCEED", EscalationService.SYSTEM_ACTOR,
                decision.reason(), trace);
        return new ProposalResult(decision, null, policy.getVersion());
    }

    public List<Checkpoint> getPendingCheckpoints(CheckpointFilter filter) {
        return checkpointService.getPendingCheckpoints(filter);
    }

    public Checkpoint getCheckpoint(String checkpointId) {
        return checkpointService.getCheckpoint(checkpointId);
    }

    public Checkpoint resolveCheckpoint(String checkpointId, ResolutionAction action, String reason,
            Map<String, Object> modifiedPayload, ImpactLevel level, String actor) {
        if (action == null) {
            throw new GovernanceValidationException("action is required");
        }
        return checkpointResolver.resolve(checkpointId, action.targetStatus(), reason, modifiedPayload, level,
                actor);
    }

    public CompletableFuture<Checkpoint> awaitResolution(String checkpointId, Duration timeout) {
        return checkpointService.awaitResolution(checkpointId, timeout);
    }

    public List<EscalationRecord> getEscalationChain(String checkpointId) {
        return escalationService.chainRecords(checkpointId);
    }

    public SweepSummary runEscalationSweep() {
        return escalationScheduler.sweep(clock.instant());
    }

    // Failures

    public FailureRecord reportFailure(String operationName, String moduleId, FailureType type,
            Map<String, Object> metadata, String errorMessage) {
        return failureMonitorService.report(operationName, moduleId, type, metadata, errorMessage);
    }

    public FailureRecord acknowledgeFailure(String failureId, String actor) {
        return failureMonitorService.acknowledge(failureId, actor);
    }

    public List<FailureRecord> listActiveFailures(String moduleId) {
        return failureMonitorService.listActiveFailures(moduleId);
    }

    public FailureRecord getFailure(String failureId) {
        return failureMonitorService.getFailure(failureId);
    }

    public FailureStats getFailureStats() {
        return failureMonitorService.getStats();
    }

    public List<RecoveryOption> getRecoveryOptions(String failureId) {
        return recoveryAdvisorService.proposeOptions(failureId);
    }

    public RecoveryResult executeRecovery(String failureId, String optionId, String actor) {
        return recoveryAdvisorService.executeRecovery(failureId, optionId, actor);
    }

    // Policy and audit

    public PolicyConfig getPolicy(String organizationId) {
        return policyService.getPolicy(organizationId);
    }

    public PolicyConfig updatePolicy(String organizationId, PolicyConfig replacement, long expectedVersion,
            String actor) {
        return policyService.updatePolicy(organizationId, replacement, expectedVersion, actor);
    }

    public List<AuditRecord> getAuditTrail(String entityId) {
        return auditService.findByEntityId(entityId);
    }
}
