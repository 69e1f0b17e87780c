package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.BaseE2ETest;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.model.ProposalResult;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import com.shlawgathon.sentientloop.backend.model.ResolutionAction;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import com.shlawgathon.sentientloop.backend.repository.EscalationRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.PolicyConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscalationSchedulerE2ETest extends BaseE2ETest {

    private static final String ORG = "acme";

    @Autowired
    private SentientLoopService sentientLoopService;

    @Autowired
    private EscalationScheduler escalationScheduler;

    @Autowired
    private CheckpointRepository checkpointRepository;

    @Autowired
    private EscalationRecordRepository escalationRecordRepository;

    @Autowired
    private PolicyConfigRepository policyConfigRepository;

    @Autowired
    private AuditRecordRepository auditRecordRepository;

    @BeforeEach
    void setUp() {
        checkpointRepository.deleteAll();
        escalationRecordRepository.deleteAll();
        policyConfigRepository.deleteAll();
        auditRecordRepository.deleteAll();

        PolicyConfig current = sentientLoopService.getPolicy(ORG);
        PolicyConfig escalating = PolicyService.defaults(ORG).toBuilder()
                .criticalEscalationPath(List.of("team-lead", "manager"))
                .notifyUsers(List.of("ops@acme.test"))
                .build();
        sentientLoopService.updatePolicy(ORG, escalating, current.getVersion(), "admin");
    }

    private Checkpoint suspendLowConfidenceAction() {
        ProposalResult result = sentientLoopService.proposeAction(ProposedAction.builder()
                .organizationId(ORG)
                .moduleId("reporting")
                .agentId("report-agent")
                .actionType("send_report")
                .title("Send weekly report")
                .confidence(0.4)
                .impact(ImpactLevel.LOW)
                .payload(Map.of("recipients", List.of("board@acme.test")))
                .build());
        assertFalse(result.mayProceed());
        return result.checkpoint();
    }

    @Test
    void shouldClimbLadderAndExpireUnattendedCheckpoint() {
        // Given
        Checkpoint checkpoint = suspendLowConfidenceAction();
        Instant createdAt = checkpoint.getCreatedAt();

        // When: first window passes, swept twice
        SweepSummary first = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(61)));
        SweepSummary repeat = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(61)));

        // Then
        assertEquals(1, first.escalated());
        assertEquals(0, repeat.escalated());
        List<EscalationRecord> chain = sentientLoopService.getEscalationChain(checkpoint.getId());
        assertEquals(1, chain.size());
        assertEquals(ImpactLevel.HIGH, chain.get(0).getLevel());
        assertEquals(List.of("team-lead"), chain.get(0).getNotifiedParties());
        assertEquals("system", chain.get(0).getTriggeredBy());
        Checkpoint afterFirst = sentientLoopService.getCheckpoint(checkpoint.getId());
        assertEquals(CheckpointStatus.PENDING, afterFirst.getStatus());
        assertEquals(ImpactLevel.HIGH, afterFirst.getEscalationLevel());
        assertEquals(1, afterFirst.getEscalationCount());

        // When: second window passes
        SweepSummary second = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(122)));

        // Then
        assertEquals(1, second.escalated());
        chain = sentientLoopService.getEscalationChain(checkpoint.getId());
        assertEquals(2, chain.size());
        assertEquals(ImpactLevel.CRITICAL, chain.get(1).getLevel());
        assertEquals(List.of("manager"), chain.get(1).getNotifiedParties());

        // When: ladder exhausted and another window passes
        SweepSummary third = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(183)));

        // Then
        assertEquals(1, third.expired());
        Checkpoint expired = sentientLoopService.getCheckpoint(checkpoint.getId());
        assertEquals(CheckpointStatus.EXPIRED, expired.getStatus());
        assertEquals("system", expired.getResolvedBy());
        assertTrue(escalationRecordRepository.findByRootCheckpointIdOrderByCreatedAtAsc(checkpoint.getId()).stream()
                .allMatch(r -> r.getResolvedAt() != null));
    }

    @Test
    void shouldReachEveryRoleOfDefaultPathBeforeExpiring() {
        // Given: the stock three-role path
        PolicyConfig current = sentientLoopService.getPolicy(ORG);
        sentientLoopService.updatePolicy(ORG, PolicyService.defaults(ORG), current.getVersion(), "admin");
        Checkpoint checkpoint = suspendLowConfidenceAction();
        Instant createdAt = checkpoint.getCreatedAt();

        // When
        escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(61)));
        escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(122)));
        SweepSummary third = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(183)));

        // Then
        assertEquals(1, third.escalated());
        assertEquals(0, third.expired());
        List<EscalationRecord> chain = sentientLoopService.getEscalationChain(checkpoint.getId());
        assertEquals(List.of("team-lead", "manager", "executive"), chain.stream()
                .map(r -> r.getNotifiedParties().get(0))
                .toList());
        assertEquals(List.of(ImpactLevel.HIGH, ImpactLevel.CRITICAL, ImpactLevel.CRITICAL), chain.stream()
                .map(EscalationRecord::getLevel)
                .toList());
        assertEquals(List.of(0, 1, 2), chain.stream().map(EscalationRecord::getRung).toList());
        assertEquals(CheckpointStatus.PENDING, sentientLoopService.getCheckpoint(checkpoint.getId()).getStatus());

        // When: one more window after the executive was notified
        SweepSummary fourth = escalationScheduler.sweep(createdAt.plus(Duration.ofMinutes(244)));

        // Then
        assertEquals(1, fourth.expired());
        assertEquals(CheckpointStatus.EXPIRED, sentientLoopService.getCheckpoint(checkpoint.getId()).getStatus());
    }

    @Test
    void shouldLeaveFreshCheckpointsAlone() {
        // Given
        Checkpoint checkpoint = suspendLowConfidenceAction();

        // When
        SweepSummary summary = escalationScheduler.sweep(checkpoint.getCreatedAt().plus(Duration.ofMinutes(30)));

        // Then
        assertEquals(0, summary.escalated());
        assertTrue(sentientLoopService.getEscalationChain(checkpoint.getId()).isEmpty());
    }

    @Test
    void shouldNotEscalateResolvedCheckpoint() {
        // Given
        Checkpoint checkpoint = suspendLowConfidenceAction();
        sentientLoopService.resolveCheckpoint(checkpoint.getId(),
                ResolutionAction.APPROVE, null, null, null, "alice");

        // When
        SweepSummary summary = escalationScheduler.sweep(checkpoint.getCreatedAt().plus(Duration.ofMinutes(61)));

        // Then
        assertEquals(0, summary.escalated());
        assertEquals(CheckpointStatus.APPROVED, sentientLoopService.getCheckpoint(checkpoint.getId()).getStatus());
    }
}
