package com.shlawgathon.sentientloop.backend.dto;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
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
@Schema(description = "Failure record")
public class FailureResponse {

    private String id;
    private String operationName;
    private String moduleId;
    private FailureType type;
    private FailureStatus status;

    @Schema(description = "Occurrences plus failed recovery executions")
    private int recoveryAttempts;

    private Instant lastRecoveryAttempt;
    private Map<String, Object> metadata;
    private String lastErrorMessage;
    private Instant firstSeenAt;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private String recoveredBy;
    private Instant recoveredAt;

    public static FailureResponse from(FailureRecord record) {
        return FailureResponse.builder()
                .id(record.getId())
                .operationName(record.getOperationName())
                .moduleId(record.getModuleId())
                .type(record.getType())
                .status(record.getStatus())
                .recoveryAttempts(record.getRecoveryAttempts())
                .lastRecoveryAttempt(record.getLastRecoveryAttempt())
                .metadata(record.getMetadata())
                .lastErrorMessage(record.getLastErrorMessage())
                .firstSeenAt(record.getFirstSeenAt())
                .acknowledgedBy(record.getAcknowledgedBy())
                .acknowledgedAt(record.getAcknowledgedAt())
                .recoveredBy(record.getRecoveredBy())
                .recoveredAt(record.getRecoveredAt())
                .build();
    }
}
