package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.BaseE2ETest;
import com.shlawgathon.sentientloop.backend.exception.AlreadyResolvedException;
import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.EscalationRecord;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.ProposalResult;
import com.shlawgathon.sentientloop.backend.model.ProposedAction;
import com.shlawgathon.sentientloop.backend.model.ResolutionAction;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.CheckpointRepository;
import com.shlawgathon.sentientloop.backend.repository.EscalationRecordRepository;
import com.shlawgathon.sentientloop.backend.repository.PolicyConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointResolverE2ETest extends BaseE2ETest {

    @Autowired
    private SentientLoopService sentientLoopService;

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
    }

    private Checkpoint suspend(String actionType, double confidence) {
        ProposalResult result = sentientLoopService.proposeAction(ProposedAction.builder()
                .organizationId("acme")
                .moduleId("billing")
                .agentId("invoice-agent")
                .actionType(actionType)
                .confidence(confidence)
                .impact(ImpactLevel.LOW)
                .payload(Map.of("amount", 500, "vendor", "Initech"))
                .build());
        assertFalse(result.mayProceed());
        return result.checkpoint();
    }

    @RepeatedTest(5)
    void shouldLetExactlyOneConcurrentResolverWin() throws Exception {
        // Given
        Checkpoint checkpoint = suspend("send_report", 0.4);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        Callable<Checkpoint> approve = () -> {
            start.await();
            return sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.APPROVE, null, null,
                    null, "alice");
        };
        Callable<Checkpoint> reject = () -> {
            start.await();
            return sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.REJECT, "bad", null,
                    null, "bob");
        };

        // When
        List<Future<Checkpoint>> futures = List.of(pool.submit(approve), pool.submit(reject));
        start.countDown();
        List<Checkpoint> winners = new ArrayList<>();
        List<AlreadyResolvedException> losers = new ArrayList<>();
        for (Future<Checkpoint> future : futures) {
            try {
                winners.add(future.get(10, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                losers.add(assertInstanceOf(AlreadyResolvedException.class, e.getCause()));
            }
        }
        pool.shutdown();

        // Then
        assertEquals(1, winners.size());
        assertEquals(1, losers.size());
        Checkpoint stored = checkpointRepository.findById(checkpoint.getId()).orElseThrow();
        assertEquals(winners.get(0).getStatus(), stored.getStatus());
        assertTrue(stored.getStatus() == CheckpointStatus.APPROVED || stored.getStatus() == CheckpointStatus.REJECTED);
        assertEquals(stored.getStatus(), losers.get(0).getCurrent().getStatus());
    }

    @Test
    void shouldReleaseModifiedPayload() {
        // Given
        Checkpoint checkpoint = suspend("payment", 0.4);

        // When
        Checkpoint modified = sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.MODIFY,
                "Cap the amount", Map.of("amount", 250, "vendor", "Initech"), null, "alice");

        // Then
        assertEquals(CheckpointStatus.MODIFIED, modified.getStatus());
        assertEquals(250, modified.effectivePayload().get("amount"));
        assertEquals(500, modified.getOriginalPayload().get("amount"));
        assertEquals("alice", modified.getResolvedBy());
        assertNotNull(modified.getResolvedAt());
    }

    @Test
    void shouldRecordAuditTrailOfResolution() throws Exception {
        // Given
        Checkpoint checkpoint = suspend("delete", 0.3);

        // When
        sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.APPROVE, null, null, null, "alice");

        // Then: audit writes are asynchronous
        List<AuditRecord> trail = List.of();
        for (int i = 0; i < 50 && trail.size() < 2; i++) {
            Thread.sleep(100);
            trail = sentientLoopService.getAuditTrail(checkpoint.getId());
        }
        assertEquals(2, trail.size());
        assertTrue(trail.stream().anyMatch(r -> r.getFromStatus() == null && "PENDING".equals(r.getToStatus())));
        AuditRecord approval = trail.stream()
                .filter(r -> "APPROVED".equals(r.getToStatus()))
                .findFirst()
                .orElseThrow();
        assertEquals("PENDING", approval.getFromStatus());
        assertEquals("alice", approval.getActor());
    }

    @Test
    void shouldKeepCheckpointResolvableAfterManualEscalation() {
        // Given
        Checkpoint checkpoint = suspend("payment", 0.4);

        // When
        Checkpoint escalated = sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.ESCALATE,
                "Needs the CFO", null, ImpactLevel.CRITICAL, "alice");
        Checkpoint approved = sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.APPROVE,
                null, null, null, "cfo");

        // Then
        assertEquals(CheckpointStatus.PENDING, escalated.getStatus());
        assertEquals(ImpactLevel.CRITICAL, escalated.getEscalationLevel());
        assertEquals(1, escalated.getEscalationCount());
        assertEquals(CheckpointStatus.APPROVED, approved.getStatus());
        List<EscalationRecord> chain = sentientLoopService.getEscalationChain(checkpoint.getId());
        assertEquals(1, chain.size());
        assertEquals("alice", chain.get(0).getTriggeredBy());
        assertNotNull(chain.get(0).getResolvedAt());
    }

    @Test
    void shouldWakeAwaitingAgentOnResolution() throws Exception {
        // Given
        Checkpoint checkpoint = suspend("payment", 0.4);
        CompletableFuture<Checkpoint> waiting = sentientLoopService.awaitResolution(checkpoint.getId(),
                Duration.ofSeconds(10));
        assertFalse(waiting.isDone());

        // When
        sentientLoopService.resolveCheckpoint(checkpoint.getId(), ResolutionAction.REJECT, "Duplicate invoice", null,
                null, "bob");

        // Then
        Checkpoint seen = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(CheckpointStatus.REJECTED, seen.getStatus());
        assertEquals("Duplicate invoice", seen.getResolution());
    }
}
