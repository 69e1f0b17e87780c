package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.ActionRule;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.MemoryRetention;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Full replacement of an organization's policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Complete governance policy; replaces the stored one")
public class PolicyRequest {

    @NotNull
    @Schema(description = "Version this edit is based on", example = "3")
    private Long expectedVersion;

    @NotNull
    @Schema(description = "Confidence below which actions need confirmation", example = "0.7")
    private Double confidenceThreshold;

    @Schema(description = "Always check HIGH and CRITICAL impact actions")
    private boolean alwaysCheckHighImpact;

    @Schema(description = "Per action type overrides")
    private Map<String, ActionRule> actionRules;

    @NotNull
    @Schema(description = "Level of a chain's first escalation", example = "HIGH")
    private ImpactLevel autoEscalateThreshold;

    @NotNull
    @Schema(description = "Minutes a checkpoint may stay pending per escalation step", example = "60")
    private Long escalationTimeoutMinutes;

    @Schema(description = "Fallback recipients")
    private List<String> notifyUsers;

    @Schema(description = "Recipients of successive escalations")
    private List<String> criticalEscalationPath;

    @Schema(description = "Retention windows in days")
    private MemoryRetention memoryRetention;

    @Schema(description = "Governance kill switch")
    private boolean active;

    public PolicyConfig toPolicyConfig() {
        return PolicyConfig.builder()
                .confidenceThreshold(confidenceThreshold)
                .alwaysCheckHighImpact(alwaysCheckHighImpact)
                .actionRules(actionRules != null ? new HashMap<>(actionRules) : new HashMap<>())
                .autoEscalateThreshold(autoEscalateThreshold)
                .escalationTimeoutMinutes(escalationTimeoutMinutes)
                .notifyUsers(notifyUsers != null ? new ArrayList<>(notifyUsers) : new ArrayList<>())
                .criticalEscalationPath(criticalEscalationPath != null
                        ? new ArrayList<>(criticalEscalationPath)
                        : new ArrayList<>())
                .memoryRetention(memoryRetention != null ? memoryRetention : new MemoryRetention())
                .active(active)
                .build();
    }
}
