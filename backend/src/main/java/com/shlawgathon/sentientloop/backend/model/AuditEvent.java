package com.shlawgathon.sentientloop.backend.model;

import java.time.Instant;
import java.util.Map;

/**
 * One state transition handed to the audit sink.
 */
public record AuditEvent(AuditEntityType entityType, String entityId, String fromStatus, String toStatus,
        String actor, Instant timestamp, String reason, Map<String, Object> metadata) {
}
