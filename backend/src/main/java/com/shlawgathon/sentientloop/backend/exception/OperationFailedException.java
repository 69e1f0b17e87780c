package com.shlawgathon.sentientloop.backend.exception;

import lombok.Getter;

/**
 * A monitored operation failed on every attempt. The failure is already in
 * the catalogue under {@link #getFailureId()}.
 */
@Getter
public class OperationFailedException extends GovernanceException {

    private final String failureId;

    public OperationFailedException(String message, String failureId, Throwable cause) {
        super(message, cause);
        this.failureId = failureId;
    }
}
