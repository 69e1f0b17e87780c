package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per action-type override in the checkpoint policy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActionRule {

    private boolean alwaysCheck;
    private CheckpointType checkpointType;
    private String reason;
}
