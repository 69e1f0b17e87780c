package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface CheckpointRepository extends MongoRepository<Checkpoint, String>, CheckpointRepositoryCustom {

    List<Checkpoint> findByStatusOrderByCreatedAtDesc(CheckpointStatus status);

    List<Checkpoint> findByParentCheckpointId(String parentCheckpointId);

    long countByStatus(CheckpointStatus status);

    List<Checkpoint> findByOrganizationIdAndStatusInAndResolvedAtBefore(String organizationId,
            Collection<CheckpointStatus> statuses, Instant cutoff);
}
