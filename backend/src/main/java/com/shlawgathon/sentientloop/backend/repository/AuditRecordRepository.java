package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the audit trail.
 */
@Repository
public interface AuditRecordRepository extends MongoRepository<AuditRecord, String> {

    List<AuditRecord> findByEntityIdOrderByTimestampAsc(String entityId);

    long deleteByTimestampBefore(Instant cutoff);
}
