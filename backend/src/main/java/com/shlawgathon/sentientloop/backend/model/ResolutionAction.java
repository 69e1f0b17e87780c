package com.shlawgathon.sentientloop.backend.model;

/**
 * What a human resolver asks to do with a checkpoint.
 */
public enum ResolutionAction {
    APPROVE(CheckpointStatus.APPROVED),
    REJECT(CheckpointStatus.REJECTED),
    MODIFY(CheckpointStatus.MODIFIED),
    ESCALATE(CheckpointStatus.ESCALATED);

    private final CheckpointStatus targetStatus;

    ResolutionAction(CheckpointStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public CheckpointStatus targetStatus() {
        return targetStatus;
    }
}
