package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;

import java.util.List;

/**
 * Recovery strategies for one failure type. Register a new failure class by
 * adding a bean; the advisor picks providers up by {@link #supports()}.
 */
public interface RecoveryOptionProvider {

    FailureType supports();

    /**
     * Candidate options, in any order. The advisor ranks them and marks the
     * recommendation.
     */
    List<RecoveryOption> options(FailureRecord failure);

    static RecoveryOption option(FailureRecord failure, RecoveryActionType action, String name,
            String description, double confidence) {
        return RecoveryOption.builder()
                .id(RecoveryOption.optionId(failure.getId(), action))
                .failureId(failure.getId())
                .action(action)
                .name(name)
                .description(description)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .build();
    }

    /**
     * Confidence of repeating the same thing drops with each attempt already
     * made.
     */
    static double decayed(double base, int attempts) {
        return Math.max(0.1, base - 0.1 * Math.max(0, attempts - 1));
    }

    static RecoveryOption manualOverride(FailureRecord failure, double confidence) {
        return option(failure, RecoveryActionType.MANUAL_OVERRIDE, "Request Human Intervention",
                "An operator fixes the problem by hand and marks the failure recovered", confidence);
    }
}
