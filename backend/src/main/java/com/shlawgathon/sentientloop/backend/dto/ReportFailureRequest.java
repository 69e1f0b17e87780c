package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.FailureType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
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
@Schema(description = "Failure raised by a monitored operation")
public class ReportFailureRequest {

    @NotBlank
    @Schema(description = "Failing operation", example = "sync-job")
    private String operationName;

    @NotBlank
    @Schema(description = "Module that owns the operation", example = "phantom")
    private String moduleId;

    @NotNull
    @Schema(description = "Failure class", example = "TIMEOUT")
    private FailureType type;

    @Schema(description = "Free-form context, merged into the record")
    private Map<String, Object> metadata;

    @Schema(description = "Error message of this occurrence")
    private String errorMessage;
}
