package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.ProposalResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Gate decision for a proposed action")
public class ProposalResponse {

    @Schema(description = "True when the agent may execute the action now")
    private boolean proceed;

    @Schema(description = "True when governance is switched off for the organization")
    private boolean policyDisabled;

    @Schema(description = "Checkpoint type when the action was suspended")
    private CheckpointType checkpointType;

    @Schema(description = "Reason for the decision")
    private String reason;

    @Schema(description = "Checkpoint to wait on, when suspended")
    private CheckpointResponse checkpoint;

    @Schema(description = "Policy version the decision was made against")
    private long policyVersion;

    public static ProposalResponse from(ProposalResult result) {
        return ProposalResponse.builder()
                .proceed(result.mayProceed())
                .policyDisabled(result.decision().policyDisabled())
                .checkpointType(result.decision().checkpointType())
                .reason(result.decision().reason())
                .checkpoint(result.checkpoint() != null ? CheckpointResponse.from(result.checkpoint()) : null)
                .policyVersion(result.policyVersion())
                .build();
    }
}
