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
import java.util.List;

/**
 * One rung climbed on the escalation ladder of a checkpoint chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "escalation_records")
public class EscalationRecord {

    @Id
    private String id;

    @Indexed
    private String checkpointId;

    /**
     * Root of the escalation chain (follows parentCheckpointId to the top).
     */
    @Indexed
    private String rootCheckpointId;

    // 0-based position on the chain's ladder; picks the recipient from criticalEscalationPath
    private int rung;

    private ImpactLevel level;

    private String reason;

    @Builder.Default
    private List<String> notifiedParties = new ArrayList<>();

    // "system" for sweeps, the resolver's name for manual escalations
    private String triggeredBy;

    private Instant createdAt;
    private Instant resolvedAt;
}
