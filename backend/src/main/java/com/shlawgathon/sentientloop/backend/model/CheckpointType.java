package com.shlawgathon.sentientloop.backend.model;

/**
 * Kind of human input a checkpoint asks for.
 */
public enum CheckpointType {
    DECISION_REQUIRED,
    CONFIRMATION_REQUIRED,
    INFORMATION_REQUIRED,
    VALIDATION_REQUIRED,
    ESCALATION_REQUIRED,
    AUDIT_REQUIRED
}
