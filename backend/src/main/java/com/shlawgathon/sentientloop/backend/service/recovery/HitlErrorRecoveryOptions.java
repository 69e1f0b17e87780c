package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Failures of the checkpoint loop itself.
 */
@Component
public class HitlErrorRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.HITL_ERROR;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.RESUBMIT_CHECKPOINT, "Resubmit Checkpoint",
                        "Create a fresh checkpoint for the stuck action", 0.8),
                RecoveryOptionProvider.manualOverride(failure, 0.5));
    }
}
