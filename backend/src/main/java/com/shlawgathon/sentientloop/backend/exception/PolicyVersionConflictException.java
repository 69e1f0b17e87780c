package com.shlawgathon.sentientloop.backend.exception;

import lombok.Getter;

/**
 * Policy update lost the optimistic version check.
 */
@Getter
public class PolicyVersionConflictException extends GovernanceException {

    private final long expectedVersion;
    private final long currentVersion;

    public PolicyVersionConflictException(String organizationId, long expectedVersion, long currentVersion) {
        super("Policy for " + organizationId + " is at version " + currentVersion
                + ", update was based on " + expectedVersion);
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }
}
