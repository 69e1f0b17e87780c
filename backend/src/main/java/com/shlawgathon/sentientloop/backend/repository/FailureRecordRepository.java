package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface FailureRecordRepository extends MongoRepository<FailureRecord, String>, FailureRecordRepositoryCustom {

    List<FailureRecord> findByStatusInOrderByLastRecoveryAttemptDesc(Collection<FailureStatus> statuses);

    List<FailureRecord> findByModuleIdAndStatusInOrderByLastRecoveryAttemptDesc(String moduleId,
            Collection<FailureStatus> statuses);

    long countByStatus(FailureStatus status);

    long countByType(FailureType type);

    long deleteByStatusAndRecoveredAtBefore(FailureStatus status, Instant cutoff);
}
