package com.shlawgathon.sentientloop.backend.service;

/**
 * What one sweep did to one checkpoint.
 */
public enum EscalationOutcome {
    ESCALATED,
    EXPIRED,
    SKIPPED
}
