package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.PolicyVersionConflictException;
import com.shlawgathon.sentientloop.backend.model.ActionRule;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.MemoryRetention;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.PolicyConfigRepository;
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
class PolicyServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private PolicyConfigRepository policyConfigRepository;

    @Mock
    private GovernanceEventPublisher eventPublisher;

    @Mock
    private AuditService auditService;

    private PolicyService policyService;

    @BeforeEach
    void setUp() {
        policyService = new PolicyService(policyConfigRepository, eventPublisher, auditService,
                Clock.fixed(NOW, ZoneOffset.UTC), 30);
    }

    private static PolicyConfig stored(long version) {
        return PolicyService.defaults("acme").toBuilder().id("policy-1").version(version).build();
    }

    @Test
    void shouldCreateDefaultsOnFirstRead() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.empty());
        when(policyConfigRepository.insert(any(PolicyConfig.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        PolicyConfig policy = policyService.getPolicy("acme");

        // Then
        assertEquals("acme", policy.getOrganizationId());
        assertEquals(0, policy.getVersion());
        assertEquals(0.7, policy.getConfidenceThreshold());
        assertTrue(policy.getActionRules().containsKey("payment"));
        assertEquals(List.of("team-lead", "manager", "executive"), policy.getCriticalEscalationPath());
    }

    @Test
    void shouldMapBlankOrganizationToDefault() {
        when(policyConfigRepository.findByOrganizationId("default")).thenReturn(Optional.of(stored(2)));

        assertEquals(2, policyService.getPolicy(" ").getVersion());
    }

    @Test
    void shouldServeRepeatedReadsFromCache() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(1)));

        // When
        policyService.getPolicy("acme");
        policyService.getPolicy("acme");

        // Then
        verify(policyConfigRepository, times(1)).findByOrganizationId("acme");
    }

    @Test
    void shouldReloadAfterEviction() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(1)),
                Optional.of(stored(2)));
        policyService.getPolicy("acme");

        // When
        policyService.evict("acme");

        // Then
        assertEquals(2, policyService.getPolicy("acme").getVersion());
    }

    @Test
    void shouldReplacePolicyAndBumpVersion() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(3)));
        when(policyConfigRepository.replaceIfVersionMatches(any(PolicyConfig.class), eq(3L)))
                .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));
        PolicyConfig replacement = PolicyService.defaults("ignored").toBuilder()
                .confidenceThreshold(0.9)
                .build();

        // When
        PolicyConfig saved = policyService.updatePolicy("acme", replacement, 3, "admin");

        // Then
        assertEquals(4, saved.getVersion());
        assertEquals("acme", saved.getOrganizationId());
        assertEquals("policy-1", saved.getId());
        assertEquals(0.9, saved.getConfidenceThreshold());
        assertEquals("admin", saved.getUpdatedBy());
        PolicyConfig cached = policyService.getPolicy("acme");
        assertEquals(saved, cached);
        assertNotSame(saved, cached);
        verify(auditService).record(eq(AuditEntityType.POLICY), eq("acme"), eq("v3"), eq("v4"), eq("admin"),
                anyString(), anyMap());
        verify(eventPublisher).publish(eq(GovernanceEventType.POLICY_UPDATED), eq("acme"), anyMap());
    }

    @Test
    void shouldRejectStaleExpectedVersion() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(5)));

        // When
        PolicyVersionConflictException e = assertThrows(PolicyVersionConflictException.class,
                () -> policyService.updatePolicy("acme", PolicyService.defaults("acme"), 4, "admin"));

        // Then
        assertEquals(5, e.getCurrentVersion());
        verify(policyConfigRepository, never()).replaceIfVersionMatches(any(), anyLong());
    }

    @Test
    void shouldReportConflictWhenConcurrentUpdateWins() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(1)),
                Optional.of(stored(2)));
        when(policyConfigRepository.replaceIfVersionMatches(any(PolicyConfig.class), eq(1L)))
                .thenReturn(Optional.empty());

        // When
        PolicyVersionConflictException e = assertThrows(PolicyVersionConflictException.class,
                () -> policyService.updatePolicy("acme", PolicyService.defaults("acme"), 1, "admin"));

        // Then
        assertEquals(2, e.getCurrentVersion());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldCollectEveryViolation() {
        // Given
        PolicyConfig invalid = PolicyService.defaults("acme").toBuilder()
                .confidenceThreshold(1.5)
                .escalationTimeoutMinutes(0)
                .autoEscalateThreshold(null)
                .memoryRetention(MemoryRetention.builder().shortTermDays(100).longTermDays(10).build())
                .build();
        invalid.getActionRules().put("broken", ActionRule.builder().alwaysCheck(true).build());

        // When
        GovernanceValidationException e = assertThrows(GovernanceValidationException.class,
                () -> policyService.updatePolicy("acme", invalid, 0, "admin"));

        // Then
        assertEquals(5, e.getViolations().size());
        verifyNoInteractions(policyConfigRepository);
    }

    @Test
    void shouldAcceptDefaults() {
        assertTrue(policyService.validate(PolicyService.defaults("acme")).isEmpty());
    }

    @Test
    void shouldKeepCachedPolicyIntactWhenCallerEditsItsCopy() {
        // Given
        when(policyConfigRepository.findByOrganizationId("acme")).thenReturn(Optional.of(stored(1)));
        PolicyConfig first = policyService.getPolicy("acme");

        // When
        first.setConfidenceThreshold(0.1);
        first.getActionRules().remove("payment");
        first.getActionRules().get("delete").setAlwaysCheck(false);
        first.getCriticalEscalationPath().clear();
        first.getNotifyUsers().add("intruder");
        first.getMemoryRetention().setShortTermDays(1);

        // Then
        PolicyConfig second = policyService.getPolicy("acme");
        verify(policyConfigRepository, times(1)).findByOrganizationId("acme");
        assertEquals(0.7, second.getConfidenceThreshold());
        assertTrue(second.getActionRules().containsKey("payment"));
        assertTrue(second.getActionRules().get("delete").isAlwaysCheck());
        assertEquals(List.of("team-lead", "manager", "executive"), second.getCriticalEscalationPath());
        assertEquals(List.of("admin"), second.getNotifyUsers());
        assertEquals(7, second.getMemoryRetention().getShortTermDays());
    }

    @Test
    void shouldRejectTimeoutLongerThanAYear() {
        // Given
        PolicyConfig tooLong = PolicyService.defaults("acme").toBuilder()
                .escalationTimeoutMinutes(PolicyService.MAX_ESCALATION_TIMEOUT_MINUTES + 1)
                .build();
        PolicyConfig absurd = PolicyService.defaults("acme").toBuilder()
                .escalationTimeoutMinutes(Long.MAX_VALUE)
                .build();

        // When / Then
        assertEquals(List.of("escalationTimeoutMinutes must be at most 525600"), policyService.validate(tooLong));
        assertThrows(GovernanceValidationException.class,
                () -> policyService.updatePolicy("acme", absurd, 0, "admin"));
        assertTrue(policyService.validate(PolicyService.defaults("acme").toBuilder()
                .escalationTimeoutMinutes(PolicyService.MAX_ESCALATION_TIMEOUT_MINUTES)
                .build()).isEmpty());
        verifyNoInteractions(policyConfigRepository);
    }
}
