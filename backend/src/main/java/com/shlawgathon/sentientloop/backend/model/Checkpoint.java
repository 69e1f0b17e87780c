package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A suspended agent action waiting for human resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "checkpoints")
@CompoundIndex(name = "status_org_created", def = "{'status': 1, 'organizationId': 1, 'createdAt': 1}")
public class Checkpoint {

    @Id
    private String id;

    @Indexed
    private String organizationId;

    private CheckpointType type;

    @Builder.Default
    private CheckpointStatus status = CheckpointStatus.PENDING;

    // Origin
    private String moduleId;
    private String agentId;
    private String actionType;
    private String title;
    private String description;

    @Builder.Default
    private Map<String, Object> originalPayload = new HashMap<>();

    // Only ever set together with status MODIFIED
    private Map<String, Object> modifiedPayload;

    private double confidence;
    private ImpactLevel impact;

    /**
     * Why the gate suspended the action.
     */
    private String gateReason;

    // Weak reference to the checkpoint this one re-proposes; never an ownership edge
    @Indexed
    private String parentCheckpointId;

    private Instant createdAt;

    // Resolution
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolution;

    // Escalation watermark
    private ImpactLevel escalationLevel;

    @Builder.Default
    private int escalationCount = 0;

    private Instant lastEscalatedAt;

    /**
     * Payload to execute once released: the modified payload when present.
     */
    public Map<String, Object> effectivePayload() {
        return modifiedPayload != null ? modifiedPayload : originalPayload;
    }
}
