package com.shlawgathon.sentientloop.backend.exception;

/**
 * Audit sink, notification or remediation endpoint failed. Never rolls back a
 * committed transition.
 */
public class ExternalDependencyException extends GovernanceException {

    public ExternalDependencyException(String message) {
        super(message);
    }

    public ExternalDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
