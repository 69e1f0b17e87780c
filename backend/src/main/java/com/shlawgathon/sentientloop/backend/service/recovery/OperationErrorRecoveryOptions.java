package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OperationErrorRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.OPERATION_ERROR;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.RETRY, "Retry Operation",
                        "Attempt to retry the operation with the same parameters",
                        RecoveryOptionProvider.decayed(0.7, failure.getRecoveryAttempts())),
                RecoveryOptionProvider.option(failure, RecoveryActionType.RESET_STATE, "Reset Module State",
                        "Clear the module's intermediate state and start the operation over", 0.5),
                RecoveryOptionProvider.manualOverride(failure, 0.3));
    }
}
