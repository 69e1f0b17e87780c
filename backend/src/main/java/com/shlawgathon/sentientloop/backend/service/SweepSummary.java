package com.shlawgathon.sentientloop.backend.service;

/**
 * Counts from one escalation sweep.
 */
public record SweepSummary(int scopes, int skippedScopes, int escalated, int expired) {

    public static SweepSummary empty() {
        return new SweepSummary(0, 0, 0, 0);
    }

    public SweepSummary plus(SweepSummary other) {
        return new SweepSummary(scopes + other.scopes, skippedScopes + other.skippedScopes,
                escalated + other.escalated, expired + other.expired);
    }
}
