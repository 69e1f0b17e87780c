package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class IntegrationErrorRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.INTEGRATION_ERROR;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.RETRY, "Retry Operation",
                        "Attempt to retry the call with the same parameters",
                        RecoveryOptionProvider.decayed(0.7, failure.getRecoveryAttempts())),
                RecoveryOptionProvider.option(failure, RecoveryActionType.FALLBACK_PROVIDER, "Use Fallback Approach",
                        "Route the call to the configured fallback provider", 0.65),
                RecoveryOptionProvider.manualOverride(failure, 0.3));
    }
}
