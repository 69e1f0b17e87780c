package com.shlawgathon.sentientloop.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Deduplicated record of a failing operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "failure_records")
public class FailureRecord {

    @Id
    private String id;

    private String operationName;

    @Indexed
    private String moduleId;

    private FailureType type;

    @Builder.Default
    private FailureStatus status = FailureStatus.ACTIVE;

    /**
     * Identity of the operation while the record is open, absent once
     * recovered. The unique sparse index keeps one open record per operation.
     */
    @Indexed(unique = true, sparse = true)
    private String openKey;

    @Builder.Default
    private int recoveryAttempts = 0;

    private Instant lastRecoveryAttempt;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private String lastErrorMessage;

    private Instant firstSeenAt;

    private String acknowledgedBy;
    private Instant acknowledgedAt;

    private String recoveredBy;
    private Instant recoveredAt;

    // Recovery lease, at most one execution in flight
    private String recoveryLeaseOwner;
    private Instant recoveryLeaseUntil;

    /**
     * {@code <length of operationName>:<operationName>|<moduleId>}. The length
     * prefix pins where the operation name ends, so a '|' inside either part
     * cannot make two different pairs share a key.
     */
    public static String openKey(String operationName, String moduleId) {
        return operationName.length() + ":" + operationName + "|" + moduleId;
    }
}
