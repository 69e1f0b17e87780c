package com.shlawgathon.sentientloop.backend.model;

/**
 * Status of a failure record.
 */
public enum FailureStatus {
    ACTIVE, // Reported, nobody has looked at it yet
    ACKNOWLEDGED, // A human has seen it
    RECOVERED; // A recovery action succeeded

    public boolean isOpen() {
        return this != RECOVERED;
    }
}
