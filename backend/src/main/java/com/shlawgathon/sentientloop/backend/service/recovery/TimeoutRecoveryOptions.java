package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Timeouts: try again more patiently, or ask for less.
 */
@Component
public class TimeoutRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.TIMEOUT;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.RETRY_WITH_BACKOFF, "Retry With Backoff",
                        "Retry the operation with an exponential backoff between attempts",
                        RecoveryOptionProvider.decayed(0.8, failure.getRecoveryAttempts())),
                RecoveryOptionProvider.option(failure, RecoveryActionType.REDUCE_SCOPE, "Reduce Scope",
                        "Split the operation into smaller batches that fit in the time limit", 0.6));
    }
}
