package com.shlawgathon.sentientloop.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response")
public class ApiErrorResponse {

    private int status;

    @Schema(description = "Error code", example = "ALREADY_RESOLVED")
    private String error;

    private String message;

    @Schema(description = "Validation problems")
    private List<String> violations;

    @Schema(description = "Checkpoint as it is now, when a resolution lost a race")
    private CheckpointResponse current;

    @Schema(description = "Stored policy version, on a version conflict")
    private Long currentVersion;

    private Instant timestamp;
}
