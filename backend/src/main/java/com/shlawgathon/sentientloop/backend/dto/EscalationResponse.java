package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One step of a checkpoint chain's escalation ladder")
public class EscalationResponse {

    private String id;
    private String checkpointId;
    private String rootCheckpointId;

    @Schema(description = "Position on the chain's ladder, starting at 0")
    private int rung;

    private ImpactLevel level;
    private String reason;

    @Schema(description = "Parties notified, in order")
    private List<String> notifiedParties;

    @Schema(description = "'system' for timeout sweeps, the resolver otherwise")
    private String triggeredBy;

    private Instant createdAt;
    private Instant resolvedAt;

    public static EscalationResponse from(EscalationRecord record) {
        return EscalationResponse.builder()
                .id(record.getId())
                .checkpointId(record.getCheckpointId())
                .rootCheckpointId(record.getRootCheckpointId())
                .rung(record.getRung())
                .level(record.getLevel())
                .reason(record.getReason())
                .notifiedParties(record.getNotifiedParties())
                .triggeredBy(record.getTriggeredBy())
                .createdAt(record.getCreatedAt())
                .resolvedAt(record.getResolvedAt())
                .build();
    }
}
