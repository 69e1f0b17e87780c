package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.ResolutionAction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolution of a pending checkpoint")
public class ResolveCheckpointRequest {

    @NotNull
    @Schema(description = "What to do with the checkpoint", example = "APPROVE")
    private ResolutionAction action;

    @Schema(description = "Reason, required for REJECT, MODIFY and ESCALATE")
    private String reason;

    @Schema(description = "Replacement payload, required for MODIFY")
    private Map<String, Object> modifiedPayload;

    @Schema(description = "Target level, required for ESCALATE", example = "CRITICAL")
    private ImpactLevel level;
}
