package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Governance policy of one organization. Replaced as a whole on update; the
 * version is the optimistic concurrency token.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "policy_configs")
public class PolicyConfig {

    @Id
    private String id;

    @Indexed(unique = true)
    private String organizationId;

    private long version;

    // Checkpoint thresholds
    @Builder.Default
    private double confidenceThreshold = 0.7;

    @Builder.Default
    private boolean alwaysCheckHighImpact = true;

    @Builder.Default
    private Map<String, ActionRule> actionRules = new HashMap<>();

    // Escalation rules
    @Builder.Default
    private ImpactLevel autoEscalateThreshold = ImpactLevel.HIGH;

    @Builder.Default
    private long escalationTimeoutMinutes = 60;

    @Builder.Default
    private List<String> notifyUsers = new ArrayList<>();

    @Builder.Default
    private List<String> criticalEscalationPath = new ArrayList<>();

    @Builder.Default
    private MemoryRetention memoryRetention = new MemoryRetention();

    // Global kill switch
    @Builder.Default
    private boolean active = true;

    private Instant updatedAt;
    private String updatedBy;

    public ActionRule ruleFor(String actionType) {
        if (actionType == null || actionRules == null) {
            return null;
        }
        return actionRules.get(actionType);
    }
}
