package com.shlawgathon.sentientloop.backend.exception;

import lombok.Getter;

/**
 * Requested a state edge that the lifecycle does not allow.
 */
@Getter
public class InvalidTransitionException extends GovernanceException {

    private final String entityId;
    private final String fromStatus;
    private final String toStatus;

    public InvalidTransitionException(String entityId, String fromStatus, String toStatus) {
        this(entityId, fromStatus, toStatus,
                "Illegal transition " + fromStatus + " -> " + toStatus + " for " + entityId);
    }

    protected InvalidTransitionException(String entityId, String fromStatus, String toStatus, String message) {
        super(message);
        this.entityId = entityId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
    }
}
