package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Conditional writes on checkpoints. Every method is a single atomic
 * findAndModify; an empty result means the condition did not hold.
 */
public interface CheckpointRepositoryCustom {

    /**
     * Move {@code id} from {@code expected} to {@code target}, applying
     * {@code fields} in the same write.
     */
    Optional<Checkpoint> compareAndSetStatus(String id, CheckpointStatus expected, CheckpointStatus target,
            Update fields);

    /**
     * Claim the next escalation step: only succeeds while the checkpoint is
     * PENDING and its last escalation (if any) is older than {@code cutoff}.
     */
    Optional<Checkpoint> advanceEscalationWatermark(String id, Instant cutoff, ImpactLevel level, Instant now);

    /**
     * Expire a PENDING checkpoint created before {@code cutoff} whose last
     * escalation, if any, is also older than {@code cutoff}.
     */
    Optional<Checkpoint> expireIfStale(String id, Instant cutoff, String reason, Instant now);

    List<Checkpoint> findEscalationCandidates(String organizationId, Instant cutoff);

    List<String> findPendingOrganizations();

    List<Checkpoint> findPending(CheckpointFilter filter);
}
