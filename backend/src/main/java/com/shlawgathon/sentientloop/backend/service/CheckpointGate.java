package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.ActionRule;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.GateDecision;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a proposed action may run or must wait for a human. A pure
 * function of the action and the policy, so any decision can be replayed.
 */
@Component
public class CheckpointGate {

    public GateDecision evaluate(ProposedAction action, PolicyConfig policy) {
        if (!policy.isActive()) {
            return GateDecision.disabled();
        }

        ActionRule rule = policy.ruleFor(action.getActionType());
        if (rule != null && rule.isAlwaysCheck()) {
            CheckpointType type = rule.getCheckpointType() != null
                    ? rule.getCheckpointType()
                    : CheckpointType.DECISION_REQUIRED;
            String reason = rule.getReason() != null && !rule.getReason().isBlank()
                    ? rule.getReason()
                    : "Action type '" + action.getActionType() + "' always requires review";
            return GateDecision.requireCheckpoint(type, reason);
        }

        if (policy.isAlwaysCheckHighImpact() && action.getImpact() != null
                && action.getImpact().isAtLeast(ImpactLevel.HIGH)) {
            return GateDecision.requireCheckpoint(CheckpointType.DECISION_REQUIRED,
                    action.getImpact() + " impact action requires a human decision");
        }

        if (action.getConfidence() < policy.getConfidenceThreshold()) {
            return GateDecision.requireCheckpoint(CheckpointType.CONFIRMATION_REQUIRED,
                    String.format(Locale.ROOT, "Confidence %.2f is below threshold %.2f",
                            action.getConfidence(), policy.getConfidenceThreshold()));
        }

        return GateDecision.proceed(String.format(Locale.ROOT, "Confidence %.2f meets threshold %.2f",
                action.getConfidence(), policy.getConfidenceThreshold()));
    }
}
