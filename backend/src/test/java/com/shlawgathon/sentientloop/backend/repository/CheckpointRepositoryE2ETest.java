package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.BaseE2ETest;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointRepositoryE2ETest extends BaseE2ETest {

    @Autowired
    private CheckpointRepository checkpointRepository;

    private final Instant now = Instant.parse("2026-03-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        checkpointRepository.deleteAll();
    }

    private Checkpoint pending(String organizationId, String moduleId, Duration age) {
        return checkpointRepository.save(Checkpoint.builder()
                .organizationId(organizationId)
                .type(CheckpointType.CONFIRMATION_REQUIRED)
                .moduleId(moduleId)
                .agentId("agent-1")
                .actionType("send_report")
                .confidence(0.4)
                .impact(ImpactLevel.LOW)
                .createdAt(now.minus(age))
                .build());
    }

    @Test
    void shouldOnlySwapStatusFromExpectedValue() {
        // Given
        Checkpoint checkpoint = pending("acme", "billing", Duration.ofMinutes(5));

        // When
        Optional<Checkpoint> approved = checkpointRepository.compareAndSetStatus(checkpoint.getId(),
                CheckpointStatus.PENDING, CheckpointStatus.APPROVED, new Update().set("resolvedBy", "alice"));
        Optional<Checkpoint> rejected = checkpointRepository.compareAndSetStatus(checkpoint.getId(),
                CheckpointStatus.PENDING, CheckpointStatus.REJECTED, null);

        // Then
        assertTrue(approved.isPresent());
        assertEquals(CheckpointStatus.APPROVED, approved.get().getStatus());
        assertEquals("alice", approved.get().getResolvedBy());
        assertTrue(rejected.isEmpty());
        assertEquals(CheckpointStatus.APPROVED,
                checkpointRepository.findById(checkpoint.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldAdvanceWatermarkOncePerWindow() {
        // Given
        Checkpoint checkpoint = pending("acme", "billing", Duration.ofMinutes(90));
        Instant cutoff = now.minus(Duration.ofMinutes(60));

        // When
        Optional<Checkpoint> first = checkpointRepository.advanceEscalationWatermark(checkpoint.getId(), cutoff,
                ImpactLevel.HIGH, now);
        Optional<Checkpoint> second = checkpointRepository.advanceEscalationWatermark(checkpoint.getId(), cutoff,
                ImpactLevel.HIGH, now);

        // Then
        assertTrue(first.isPresent());
        assertEquals(1, first.get().getEscalationCount());
        assertEquals(ImpactLevel.HIGH, first.get().getEscalationLevel());
        assertEquals(now, first.get().getLastEscalatedAt());
        assertTrue(second.isEmpty());
    }

    @Test
    void shouldFindOverdueCandidatesOldestFirst() {
        // Given
        Checkpoint older = pending("acme", "billing", Duration.ofMinutes(180));
        Checkpoint newer = pending("acme", "billing", Duration.ofMinutes(70));
        pending("acme", "billing", Duration.ofMinutes(10));
        pending("globex", "billing", Duration.ofMinutes(180));
        Instant cutoff = now.minus(Duration.ofMinutes(60));
        checkpointRepository.advanceEscalationWatermark(newer.getId(), cutoff, ImpactLevel.HIGH,
                now.minus(Duration.ofMinutes(5)));

        // When
        List<Checkpoint> candidates = checkpointRepository.findEscalationCandidates("acme", cutoff);

        // Then
        assertEquals(List.of(older.getId()), candidates.stream().map(Checkpoint::getId).toList());
        assertEquals(2, checkpointRepository.findPendingOrganizations().size());
    }

    @Test
    void shouldExpireOnlyWhenQuietForAWholeWindow() {
        // Given
        Checkpoint quiet = pending("acme", "billing", Duration.ofMinutes(200));
        Checkpoint recentlyEscalated = pending("acme", "billing", Duration.ofMinutes(200));
        Instant cutoff = now.minus(Duration.ofMinutes(60));
        checkpointRepository.advanceEscalationWatermark(quiet.getId(), now, ImpactLevel.CRITICAL,
                now.minus(Duration.ofMinutes(61)));
        checkpointRepository.advanceEscalationWatermark(recentlyEscalated.getId(), now, ImpactLevel.CRITICAL,
                now.minus(Duration.ofMinutes(30)));

        // When
        Optional<Checkpoint> expired = checkpointRepository.expireIfStale(quiet.getId(), cutoff, "Ladder exhausted",
                now);
        Optional<Checkpoint> kept = checkpointRepository.expireIfStale(recentlyEscalated.getId(), cutoff,
                "Ladder exhausted", now);

        // Then
        assertTrue(expired.isPresent());
        assertEquals(CheckpointStatus.EXPIRED, expired.get().getStatus());
        assertEquals("system", expired.get().getResolvedBy());
        assertTrue(kept.isEmpty());
    }

    @Test
    void shouldFilterPendingCheckpoints() {
        // Given
        pending("acme", "billing", Duration.ofMinutes(5));
        Checkpoint crm = pending("acme", "crm", Duration.ofMinutes(3));
        Checkpoint resolved = pending("acme", "crm", Duration.ofMinutes(1));
        checkpointRepository.compareAndSetStatus(resolved.getId(), CheckpointStatus.PENDING,
                CheckpointStatus.APPROVED, null);

        // When
        List<Checkpoint> all = checkpointRepository.findPending(new CheckpointFilter("acme", null, null, null));
        List<Checkpoint> crmOnly = checkpointRepository.findPending(new CheckpointFilter(null, "crm", null, null));

        // Then
        assertEquals(2, all.size());
        assertEquals(List.of(crm.getId()), crmOnly.stream().map(Checkpoint::getId).toList());
    }
}
