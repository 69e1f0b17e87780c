package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.ActionRule;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.GateDecision;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointGateTest {

    private final CheckpointGate gate = new CheckpointGate();

    private static ProposedAction action(String actionType, double confidence, ImpactLevel impact) {
        return ProposedAction.builder()
                .moduleId("billing")
                .agentId("invoice-agent")
                .actionType(actionType)
                .confidence(confidence)
                .impact(impact)
                .build();
    }

    @Test
    void shouldProceedWhenConfidenceMeetsThreshold() {
        // Given
        PolicyConfig policy = PolicyService.defaults("acme");

        // When
        GateDecision decision = gate.evaluate(action("send_report", 0.85, ImpactLevel.LOW), policy);

        // Then
        assertFalse(decision.checkpointRequired());
        assertFalse(decision.policyDisabled());
        assertTrue(decision.reason().contains("0.85"));
    }

    @Test
    void shouldProceedWhenConfidenceEqualsThreshold() {
        GateDecision decision = gate.evaluate(action("send_report", 0.7, ImpactLevel.MEDIUM),
                PolicyService.defaults("acme"));

        assertFalse(decision.checkpointRequired());
    }

    @Test
    void shouldRequireConfirmationBelowThreshold() {
        // Given
        PolicyConfig policy = PolicyService.defaults("acme");

        // When
        GateDecision decision = gate.evaluate(action("send_report", 0.55, ImpactLevel.LOW), policy);

        // Then
        assertTrue(decision.checkpointRequired());
        assertEquals(CheckpointType.CONFIRMATION_REQUIRED, decision.checkpointType());
        assertTrue(decision.reason().contains("0.55"));
        assertTrue(decision.reason().contains("0.70"));
    }

    @Test
    void shouldApplyActionRuleRegardlessOfConfidence() {
        // Given: default policy always reviews payments
        PolicyConfig policy = PolicyService.defaults("acme");

        // When
        GateDecision decision = gate.evaluate(action("payment", 0.99, ImpactLevel.LOW), policy);

        // Then
        assertTrue(decision.checkpointRequired());
        assertEquals(CheckpointType.DECISION_REQUIRED, decision.checkpointType());
        assertEquals("Payment operations require human decision", decision.reason());
    }

    @Test
    void shouldPreferActionRuleOverHighImpact() {
        GateDecision decision = gate.evaluate(action("delete", 0.99, ImpactLevel.CRITICAL),
                PolicyService.defaults("acme"));

        assertEquals(CheckpointType.CONFIRMATION_REQUIRED, decision.checkpointType());
    }

    @Test
    void shouldRequireDecisionForHighImpact() {
        GateDecision decision = gate.evaluate(action("deploy", 0.95, ImpactLevel.HIGH),
                PolicyService.defaults("acme"));

        assertTrue(decision.checkpointRequired());
        assertEquals(CheckpointType.DECISION_REQUIRED, decision.checkpointType());
    }

    @Test
    void shouldSkipHighImpactCheckWhenDisabledInPolicy() {
        // Given
        PolicyConfig policy = PolicyService.defaults("acme").toBuilder()
                .alwaysCheckHighImpact(false)
                .build();

        // When
        GateDecision decision = gate.evaluate(action("deploy", 0.95, ImpactLevel.CRITICAL), policy);

        // Then
        assertFalse(decision.checkpointRequired());
    }

    @Test
    void shouldIgnoreRulesThatAreNotAlwaysCheck() {
        // Given
        PolicyConfig policy = PolicyService.defaults("acme");
        policy.getActionRules().put("export", ActionRule.builder()
                .alwaysCheck(false)
                .checkpointType(CheckpointType.AUDIT_REQUIRED)
                .build());

        // When
        GateDecision decision = gate.evaluate(action("export", 0.9, ImpactLevel.LOW), policy);

        // Then
        assertFalse(decision.checkpointRequired());
    }

    @Test
    void shouldBypassEverythingWhenPolicyInactive() {
        // Given
        PolicyConfig policy = PolicyService.defaults("acme").toBuilder()
                .active(false)
                .build();

        // When
        GateDecision decision = gate.evaluate(action("payment", 0.1, ImpactLevel.CRITICAL), policy);

        // Then
        assertFalse(decision.checkpointRequired());
        assertTrue(decision.policyDisabled());
    }

    @Test
    void shouldReturnSameDecisionForSameInputs() {
        PolicyConfig policy = PolicyService.defaults("acme");
        ProposedAction proposed = action("send_report", 0.4, ImpactLevel.MEDIUM);

        assertEquals(gate.evaluate(proposed, policy), gate.evaluate(proposed, policy));
    }
}
