package com.shlawgathon.sentientloop.backend.model;

/**
 * Entities whose state transitions are audited.
 */
public enum AuditEntityType {
    CHECKPOINT,
    ESCALATION,
    FAILURE,
    POLICY,
    ACTION
}
