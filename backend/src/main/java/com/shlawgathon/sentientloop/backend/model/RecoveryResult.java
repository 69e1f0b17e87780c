package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of executing a recovery option.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryResult {

    private String failureId;
    private String optionId;
    private RecoveryActionType action;
    private boolean success;
    private String message;
    private FailureStatus failureStatus;
    private int recoveryAttempts;
    private Instant completedAt;
}
