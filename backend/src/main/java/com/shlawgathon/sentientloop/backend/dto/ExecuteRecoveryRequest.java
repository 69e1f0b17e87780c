package com.shlawgathon.sentientloop.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recovery option chosen by an operator")
public class ExecuteRecoveryRequest {

    @NotBlank
    @Schema(description = "Option ID from the recovery-options listing", example = "65a1b2c3:retry")
    private String optionId;
}
