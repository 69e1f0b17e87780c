package com.shlawgathon.sentientloop.backend.model;

/**
 * Result of the checkpoint gate: either proceed, or suspend behind a checkpoint
 * of the given type.
 */
public record GateDecision(boolean checkpointRequired, CheckpointType checkpointType, String reason,
        boolean policyDisabled) {

    public static GateDecision proceed(String reason) {
        return new GateDecision(false, null, reason, false);
    }

    public static GateDecision disabled() {
        return new GateDecision(false, null, "Governance is disabled for this organization", true);
    }

    public static GateDecision requireCheckpoint(CheckpointType type, String reason) {
        return new GateDecision(true, type, reason, false);
    }
}
