package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureType;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Atomic writes on failure records.
 */
public interface FailureRecordRepositoryCustom {

    /**
     * Insert a new ACTIVE record for (operationName, moduleId) or bump the
     * open one. Both paths leave {@code recoveryAttempts} counting reports.
     */
    FailureRecord upsertOpenFailure(String operationName, String moduleId, FailureType type,
            Map<String, Object> metadata, String errorMessage, Instant now);

    Optional<FailureRecord> acknowledge(String id, String actor, Instant now);

    /**
     * Take the recovery lease when the record is open and no live lease
     * exists.
     */
    Optional<FailureRecord> acquireRecoveryLease(String id, String owner, Instant now, Instant leaseUntil);

    Optional<FailureRecord> completeRecovery(String id, String owner, String actor, Instant now);

    Optional<FailureRecord> failRecovery(String id, String owner, String errorMessage, Instant now);

    Map<String, Long> countOpenByModule();
}
