package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An action an agent wants to execute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedAction {

    private String organizationId;
    private String moduleId;
    private String agentId;
    private String actionType;
    private String title;
    private String description;
    private Map<String, Object> payload;
    private double confidence;
    private ImpactLevel impact;
    private String parentCheckpointId;
}
