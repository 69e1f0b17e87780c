package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface EscalationRecordRepository extends MongoRepository<EscalationRecord, String> {

    List<EscalationRecord> findByCheckpointIdOrderByCreatedAtAsc(String checkpointId);

    List<EscalationRecord> findByRootCheckpointIdOrderByCreatedAtAsc(String rootCheckpointId);

    long countByRootCheckpointId(String rootCheckpointId);

    @Query("{ 'checkpointId': ?0, 'resolvedAt': null }")
    @Update("{ '$set': { 'resolvedAt': ?1 } }")
    long closeOpenRecords(String checkpointId, Instant resolvedAt);

    long deleteByCheckpointIdIn(Collection<String> checkpointIds);
}
