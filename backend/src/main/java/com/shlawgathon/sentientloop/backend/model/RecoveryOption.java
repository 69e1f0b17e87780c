package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A candidate remediation for a failure. Not stored: options are derived from
 * the failure each time, so their ids are deterministic.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryOption {

    private String id;
    private String failureId;
    private RecoveryActionType action;
    private String name;
    private String description;
    private double confidence;
    private boolean recommended;

    public static String optionId(String failureId, RecoveryActionType action) {
        return failureId + ":" + action.name().toLowerCase();
    }
}
