package com.shlawgathon.sentientloop.backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a checkpoint.
 *
 * <pre>
 * PENDING   -> APPROVED | REJECTED | MODIFIED | ESCALATED | EXPIRED
 * ESCALATED -> PENDING | EXPIRED
 * </pre>
 *
 * APPROVED, REJECTED, MODIFIED and EXPIRED are terminal.
 */
public enum CheckpointStatus {
    PENDING,
    APPROVED,
    REJECTED,
    MODIFIED,
    ESCALATED,
    EXPIRED;

    private static final Set<CheckpointStatus> HUMAN_TARGETS = EnumSet.of(APPROVED, REJECTED, MODIFIED, ESCALATED);

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == MODIFIED || this == EXPIRED;
    }

    public boolean canTransitionTo(CheckpointStatus target) {
        return switch (this) {
            case PENDING -> target == APPROVED || target == REJECTED || target == MODIFIED
                    || target == ESCALATED || target == EXPIRED;
            case ESCALATED -> target == PENDING || target == EXPIRED;
            default -> false;
        };
    }

    /**
     * Whether a human resolver may request this status. ESCALATED -> PENDING and
     * expiry are engine-internal.
     */
    public boolean isHumanResolvable() {
        return HUMAN_TARGETS.contains(this);
    }

    /**
     * Terminal states that release the gated action for execution.
     */
    public boolean releasesAction() {
        return this == APPROVED || this == MODIFIED;
    }
}
