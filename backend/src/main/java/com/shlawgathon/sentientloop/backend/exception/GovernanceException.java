package com.shlawgathon.sentientloop.backend.exception;

/**
 * Base class of the governance engine's error taxonomy.
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String message) {
        super(message);
    }

    protected GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
