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
 * Append-only audit trail entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "audit_records")
public class AuditRecord {

    @Id
    private String id;

    private AuditEntityType entityType;

    @Indexed
    private String entityId;

    private String fromStatus;
    private String toStatus;
    private String actor;
    private String reason;

    @Indexed
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static AuditRecord from(AuditEvent event) {
        return AuditRecord.builder()
                .entityType(event.entityType())
                .entityId(event.entityId())
                .fromStatus(event.fromStatus())
                .toStatus(event.toStatus())
                .actor(event.actor())
                .reason(event.reason())
                .timestamp(event.timestamp())
                .metadata(event.metadata() != null ? new HashMap<>(event.metadata()) : new HashMap<>())
                .build();
    }
}
