package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.ExternalDependencyException;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;

/**
 * Carries out a recovery option in the module that owns the failure.
 */
public interface RemediationGateway {

    /**
     * @throws ExternalDependencyException when the module cannot be reached
     */
    RemediationOutcome execute(FailureRecord failure, RecoveryOption option);

    record RemediationOutcome(boolean success, String message) {

        public static RemediationOutcome succeeded(String message) {
            return new RemediationOutcome(true, message);
        }

        public static RemediationOutcome failed(String message) {
            return new RemediationOutcome(false, message);
        }
    }
}
