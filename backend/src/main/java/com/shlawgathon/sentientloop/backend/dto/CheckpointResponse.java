package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Checkpoint details")
public class CheckpointResponse {

    @Schema(description = "Checkpoint ID")
    private String id;

    @Schema(description = "Organization whose policy created the checkpoint")
    private String organizationId;

    @Schema(description = "Kind of human input required")
    private CheckpointType type;

    @Schema(description = "Lifecycle status")
    private CheckpointStatus status;

    private String moduleId;
    private String agentId;
    private String actionType;
    private String title;
    private String description;

    @Schema(description = "Payload as proposed by the agent")
    private Map<String, Object> originalPayload;

    @Schema(description = "Payload substituted by the resolver (MODIFIED only)")
    private Map<String, Object> modifiedPayload;

    private double confidence;
    private ImpactLevel impact;

    @Schema(description = "Why the gate suspended the action")
    private String gateReason;

    private String parentCheckpointId;
    private Instant createdAt;
    private Instant resolvedAt;
    private String resolvedBy;

    @Schema(description = "Resolver's reason")
    private String resolution;

    @Schema(description = "Highest escalation level reached")
    private ImpactLevel escalationLevel;

    private int escalationCount;
    private Instant lastEscalatedAt;

    public static CheckpointResponse from(Checkpoint checkpoint) {
        return CheckpointResponse.builder()
                .id(checkpoint.getId())
                .organizationId(checkpoint.getOrganizationId())
                .type(checkpoint.getType())
                .status(checkpoint.getStatus())
                .moduleId(checkpoint.getModuleId())
                .agentId(checkpoint.getAgentId())
                .actionType(checkpoint.getActionType())
                .title(checkpoint.getTitle())
                .description(checkpoint.getDescription())
                .originalPayload(checkpoint.getOriginalPayload())
                .modifiedPayload(checkpoint.getModifiedPayload())
                .confidence(checkpoint.getConfidence())
                .impact(checkpoint.getImpact())
                .gateReason(checkpoint.getGateReason())
                .parentCheckpointId(checkpoint.getParentCheckpointId())
                .createdAt(checkpoint.getCreatedAt())
                .resolvedAt(checkpoint.getResolvedAt())
                .resolvedBy(checkpoint.getResolvedBy())
                .resolution(checkpoint.getResolution())
                .escalationLevel(checkpoint.getEscalationLevel())
                .escalationCount(checkpoint.getEscalationCount())
                .lastEscalatedAt(checkpoint.getLastEscalatedAt())
                .build();
    }
}
