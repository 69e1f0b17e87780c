package com.shlawgathon.sentientloop.backend.model;

/**
 * What happened to a proposed action: it may run now, or it waits behind
 * {@code checkpoint}.
 */
public record ProposalResult(GateDecision decision, Checkpoint checkpoint, long policyVersion) {

    public boolean mayProceed() {
        return !decision.checkpointRequired();
    }
}
