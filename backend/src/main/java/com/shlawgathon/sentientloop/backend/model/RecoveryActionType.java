package com.shlawgathon.sentientloop.backend.model;

/**
 * Remediation actions a recovery option can perform.
 */
public enum RecoveryActionType {
    RETRY,
    RETRY_WITH_BACKOFF,
    REDUCE_SCOPE,
    FALLBACK_PROVIDER,
    RESET_STATE,
    REBUILD_CONTEXT,
    RESUBMIT_CHECKPOINT,
    MANUAL_OVERRIDE;

    /**
     * Manual override records a human's statement that the problem is fixed; no
     * remediation call is made.
     */
    public boolean requiresRemediationCall() {
        return this != MANUAL_OVERRIDE;
    }
}
