package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * An agent asking whether it may execute an action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Action proposed by an autonomous agent")
public class ProposeActionRequest {

    @Schema(description = "Organization whose policy applies (defaults to 'default')", example = "acme")
    private String organizationId;

    @NotBlank
    @Schema(description = "Module the agent belongs to", example = "billing")
    private String moduleId;

    @NotBlank
    @Schema(description = "Proposing agent", example = "invoice-agent")
    private String agentId;

    @NotBlank
    @Schema(description = "Action type, matched against the policy's action rules", example = "payment")
    private String actionType;

    @Schema(description = "Short title shown to resolvers")
    private String title;

    @Schema(description = "Longer description of the action")
    private String description;

    @Schema(description = "Action payload executed once released")
    private Map<String, Object> payload;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Agent's self-reported confidence (0-1)", example = "0.82")
    private Double confidence;

    @Schema(description = "Impact of the action (defaults to MEDIUM)", example = "HIGH")
    private ImpactLevel impact;

    @Schema(description = "Checkpoint this proposal follows up on")
    private String parentCheckpointId;

    public ProposedAction toProposedAction() {
        return ProposedAction.builder()
                .organizationId(organizationId)
                .moduleId(moduleId)
                .agentId(agentId)
                .actionType(actionType)
                .title(title)
                .description(description)
                .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                .confidence(confidence)
                .impact(impact)
                .parentCheckpointId(parentCheckpointId)
                .build();
    }
}
