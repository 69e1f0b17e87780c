package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.AuditEvent;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuditSink auditSink;

    @Mock
    private AuditRecordRepository auditRecordRepository;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditSink, auditRecordRepository, Runnable::run,
                Clock.fixed(NOW, ZoneOffset.UTC), quickRetry());
    }

    @Test
    void shouldStampEventWithClock() {
        // When
        auditService.record(AuditEntityType.CHECKPOINT, "cp-1", "PENDING", "APPROVED", "alice", null, null);

        // Then
        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).record(event.capture());
        assertEquals(NOW, event.getValue().timestamp());
        assertEquals("APPROVED", event.getValue().toStatus());
        assertEquals(Map.of(), event.getValue().metadata());
    }

    @Test
    void shouldRetryUntilSinkAccepts() {
        // Given
        doThrow(new IllegalStateException("mongo down"))
                .doThrow(new IllegalStateException("mongo down"))
                .doNothing()
                .when(auditSink).record(any());

        // When
        auditService.record(AuditEntityType.FAILURE, "f-1", null, "ACTIVE", "phantom", "boom", Map.of());

        // Then
        verify(auditSink, times(3)).record(any());
    }

    @Test
    void shouldDropEventAfterMaxAttemptsWithoutThrowing() {
        // Given
        doThrow(new IllegalStateException("mongo down")).when(auditSink).record(any());

        // When / Then
        assertDoesNotThrow(() -> auditService.record(AuditEntityType.FAILURE, "f-1", null, "ACTIVE", "phantom",
                null, Map.of()));
        verify(auditSink, times(3)).record(any());
    }

    @Test
    void shouldNotFailCallerWhenExecutorRejects() {
        // Given
        Executor saturated = command -> {
            throw new RejectedExecutionException("full");
        };
        AuditService rejecting = new AuditService(auditSink, auditRecordRepository, saturated,
                Clock.fixed(NOW, ZoneOffset.UTC), quickRetry());

        // When / Then
        assertDoesNotThrow(() -> rejecting.record(AuditEntityType.POLICY, "acme", "v1", "v2", "admin", null,
                Map.of()));
        verifyNoInteractions(auditSink);
    }

    private static Retry quickRetry() {
        return Retry.of("audit-test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .build());
    }
}
