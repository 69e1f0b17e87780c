package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.InvalidTransitionException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.exception.RecoveryInProgressException;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import com.shlawgathon.sentientloop.backend.model.RecoveryActionType;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import com.shlawgathon.sentientloop.backend.model.RecoveryResult;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.FailureRecordRepository;
import com.shlawgathon.sentientloop.backend.service.RemediationGateway.RemediationOutcome;
import com.shlawgathon.sentientloop.backend.service.recovery.DecisionErrorRecoveryOptions;
import com.shlawgathon.sentientloop.backend.service.recovery.HitlErrorRecoveryOptions;
import com.shlawgathon.sentientloop.backend.service.recovery.IntegrationErrorRecoveryOptions;
import com.shlawgathon.sentientloop.backend.service.recovery.MemoryErrorRecoveryOptions;
import com.shlawgathon.sentientloop.backend.service.recovery.OperationErrorRecoveryOptions;
import com.shlawgathon.sentientloop.backend.service.recovery.RecoveryOptionProvider;
import com.shlawgathon.sentientloop.backend.service.recovery.TimeoutRecoveryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecoveryAdvisorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private FailureRecordRepository failureRecordRepository;

    @Mock
    private RemediationGateway remediationGateway;

    @Mock
    private AuditService auditService;

    @Mock
    private GovernanceEventPublisher eventPublisher;

    private RecoveryAdvisorService advisor;

    @BeforeEach
    void setUp() {
        List<RecoveryOptionProvider> providers = List.of(new TimeoutRecoveryOptions(),
                new OperationErrorRecoveryOptions(), new DecisionErrorRecoveryOptions(),
                new IntegrationErrorRecoveryOptions(), new MemoryErrorRecoveryOptions(),
                new HitlErrorRecoveryOptions());
        advisor = new RecoveryAdvisorService(providers, failureRecordRepository, remediationGateway, auditService,
                eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC), 120);
    }

    private static FailureRecord failure(FailureType type, FailureStatus status, int attempts) {
        return FailureRecord.builder()
                .id("f-1")
                .operationName("sync-job")
                .moduleId("phantom")
                .type(type)
                .status(status)
                .recoveryAttempts(attempts)
                .build();
    }

    @Test
    void shouldRankOptionsAndRecommendOnlyTheBest() {
        // Given
        when(failureRecordRepository.findById("f-1"))
                .thenReturn(Optional.of(failure(FailureType.TIMEOUT, FailureStatus.ACTIVE, 1)));

        // When
        List<RecoveryOption> options = advisor.proposeOptions("f-1");

        // Then
        assertEquals(RecoveryActionType.RETRY_WITH_BACKOFF, options.get(0).getAction());
        assertEquals(0.8, options.get(0).getConfidence(), 1e-9);
        assertTrue(options.get(0).isRecommended());
        assertEquals(1, options.stream().filter(RecoveryOption::isRecommended).count());
        assertEquals("f-1:retry_with_backoff", options.get(0).getId());
    }

    @Test
    void shouldLowerRetryConfidenceAfterRepeatedAttempts() {
        // Given: four attempts push retry below reducing scope
        when(failureRecordRepository.findById("f-1"))
                .thenReturn(Optional.of(failure(FailureType.TIMEOUT, FailureStatus.ACTIVE, 4)));

        // When
        List<RecoveryOption> options = advisor.proposeOptions("f-1");

        // Then
        assertEquals(RecoveryActionType.REDUCE_SCOPE, options.get(0).getAction());
        assertEquals(0.5, options.get(1).getConfidence(), 1e-9);
    }

    @Test
    void shouldRefuseOptionsForRecoveredFailure() {
        when(failureRecordRepository.findById("f-1"))
                .thenReturn(Optional.of(failure(FailureType.TIMEOUT, FailureStatus.RECOVERED, 1)));

        assertThrows(InvalidTransitionException.class, () -> advisor.proposeOptions("f-1"));
    }

    @Test
    void shouldRecoverWhenRemediationSucceeds() {
        // Given
        FailureRecord active = failure(FailureType.INTEGRATION_ERROR, FailureStatus.ACTIVE, 1);
        FailureRecord recovered = failure(FailureType.INTEGRATION_ERROR, FailureStatus.RECOVERED, 1);
        when(failureRecordRepository.findById("f-1")).thenReturn(Optional.of(active));
        when(failureRecordRepository.acquireRecoveryLease(eq("f-1"), anyString(), eq(NOW), eq(NOW.plusSeconds(120))))
                .thenReturn(Optional.of(active));
        when(remediationGateway.execute(eq(active), any(RecoveryOption.class)))
                .thenReturn(RemediationOutcome.succeeded("switched provider"));
        when(failureRecordRepository.completeRecovery(eq("f-1"), anyString(), eq("ops"), eq(NOW)))
                .thenReturn(Optional.of(recovered));

        // When
        RecoveryResult result = advisor.executeRecovery("f-1", "f-1:fallback_provider", "ops");

        // Then
        assertTrue(result.isSuccess());
        assertEquals(FailureStatus.RECOVERED, result.getFailureStatus());
        assertEquals(RecoveryActionType.FALLBACK_PROVIDER, result.getAction());
        verify(eventPublisher).publish(eq(GovernanceEventType.FAILURE_RECOVERED), eq("f-1"), anyMap());
    }

    @Test
    void shouldKeepFailureOpenWhenRemediationFails() {
        // Given
        FailureRecord active = failure(FailureType.OPERATION_ERROR, FailureStatus.ACTIVE, 1);
        FailureRecord stillActive = failure(FailureType.OPERATION_ERROR, FailureStatus.ACTIVE, 2);
        when(failureRecordRepository.findById("f-1")).thenReturn(Optional.of(active));
        when(failureRecordRepository.acquireRecoveryLease(eq("f-1"), anyString(), any(), any()))
                .thenReturn(Optional.of(active));
        when(remediationGateway.execute(eq(active), any(RecoveryOption.class)))
                .thenThrow(new IllegalStateException("endpoint unreachable"));
        when(failureRecordRepository.failRecovery(eq("f-1"), anyString(), eq("endpoint unreachable"), eq(NOW)))
                .thenReturn(Optional.of(stillActive));

        // When
        RecoveryResult result = advisor.executeRecovery("f-1", "f-1:retry", "ops");

        // Then
        assertFalse(result.isSuccess());
        assertEquals(FailureStatus.ACTIVE, result.getFailureStatus());
        assertEquals(2, result.getRecoveryAttempts());
        verify(eventPublisher, never()).publish(eq(GovernanceEventType.FAILURE_RECOVERED), any(), anyMap());
    }

    @Test
    void shouldRecoverByManualOverrideWithoutRemoteCall() {
        // Given
        FailureRecord active = failure(FailureType.HITL_ERROR, FailureStatus.ACKNOWLEDGED, 1);
        when(failureRecordRepository.findById("f-1")).thenReturn(Optional.of(active));
        when(failureRecordRepository.acquireRecoveryLease(eq("f-1"), anyString(), any(), any()))
                .thenReturn(Optional.of(active));
        when(failureRecordRepository.completeRecovery(eq("f-1"), anyString(), eq("ops"), any()))
                .thenReturn(Optional.of(failure(FailureType.HITL_ERROR, FailureStatus.RECOVERED, 1)));

        // When
        RecoveryResult result = advisor.executeRecovery("f-1", "f-1:manual_override", "ops");

        // Then
        assertTrue(result.isSuccess());
        verifyNoInteractions(remediationGateway);
    }

    @Test
    void shouldRejectConcurrentExecution() {
        // Given
        FailureRecord active = failure(FailureType.TIMEOUT, FailureStatus.ACTIVE, 1);
        when(failureRecordRepository.findById("f-1")).thenReturn(Optional.of(active));
        when(failureRecordRepository.acquireRecoveryLease(eq("f-1"), anyString(), any(), any()))
                .thenReturn(Optional.empty());

        // When / Then
        assertThrows(RecoveryInProgressException.class,
                () -> advisor.executeRecovery("f-1", "f-1:retry_with_backoff", "ops"));
        verifyNoInteractions(remediationGateway);
    }

    @Test
    void shouldRejectUnknownOption() {
        when(failureRecordRepository.findById("f-1"))
                .thenReturn(Optional.of(failure(FailureType.TIMEOUT, FailureStatus.ACTIVE, 1)));

        assertThrows(NotFoundException.class, () -> advisor.executeRecovery("f-1", "f-1:teleport", "ops"));
    }

    @Test
    void shouldRefuseTwoProvidersForOneFailureType() {
        List<RecoveryOptionProvider> duplicated = List.of(new TimeoutRecoveryOptions(), new TimeoutRecoveryOptions());

        assertThrows(IllegalStateException.class, () -> new RecoveryAdvisorService(duplicated,
                failureRecordRepository, remediationGateway, auditService, eventPublisher, Clock.systemUTC(), 60));
    }
}
