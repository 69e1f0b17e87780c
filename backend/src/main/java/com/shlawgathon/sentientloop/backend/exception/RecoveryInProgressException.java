package com.shlawgathon.sentientloop.backend.exception;

public class RecoveryInProgressException extends GovernanceException {

    public RecoveryInProgressException(String failureId) {
        super("A recovery is already running for failure " + failureId);
    }
}
