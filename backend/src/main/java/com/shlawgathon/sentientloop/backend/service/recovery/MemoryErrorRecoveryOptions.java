package com.shlawgathon.sentientloop.backend.service.recovery;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MemoryErrorRecoveryOptions implements RecoveryOptionProvider {

    @Override
    public FailureType supports() {
        return FailureType.MEMORY_ERROR;
    }

    @Override
    public List<RecoveryOption> options(FailureRecord failure) {
        return List.of(
                RecoveryOptionProvider.option(failure, RecoveryActionType.REBUILD_CONTEXT, "Rebuild Memory",
                        "Rebuild the module's memory store from the audit trail", 0.7),
                RecoveryOptionProvider.option(failure, RecoveryActionType.RESET_STATE, "Reset Memory State",
                        "Drop short-term memory and continue from long-term memory only", 0.55),
                RecoveryOptionProvider.manualOverride(failure, 0.3));
    }
}
