package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * A bad agent decision is best put back in front of a human.
 */
@Component
public class DecisionErrorRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.DECISION_ERROR;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.RESUBMIT_CHECKPOINT, "Resubmit For Review",
                        "Re-propose the decision behind a new human checkpoint", 0.75),
                RecoveryOptionProvider.option(failure, RecoveryActionType.REBUILD_CONTEXT, "Rebuild Decision Context",
                        "Reload the agent's context and let it decide again", 0.6),
                RecoveryOptionProvider.manualOverride(failure, 0.3));
    }
}
