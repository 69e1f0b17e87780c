package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.PolicyVersionConflictException;
import com.shlawgathon.sentientloop.backend.model.ActionRule;
import com.shlawgathon.sentientloop.backend.model.AuditEntityType;
import com.shlawgathon.sentientloop.backend.model.CheckpointType;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import com.shlawgathon.sentientloop.backend.model.MemoryRetention;
import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventPublisher;
import com.shlawgathon.sentientloop.backend.pubsub.GovernanceEventType;
import com.shlawgathon.sentientloop.backend.repository.PolicyConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Policy store. Reads go through a short-lived per-organization cache; writes
 * replace the whole document guarded by its version.
 */
@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    public static final String DEFAULT_ORGANIZATION = "default";

    // One year; longer windows would push sweep cutoffs outside the Instant range
    static final long MAX_ESCALATION_TIMEOUT_MINUTES = 525_600;

    private final PolicyConfigRepository policyConfigRepository;
    private final GovernanceEventPublisher eventPublisher;
    private final AuditService auditService;
    private final Clock clock;
    private final Duration cacheTtl;

    private final Map<String, CachedPolicy> cache = new ConcurrentHashMap<>();

    public PolicyService(
            PolicyConfigRepository policyConfigRepository,
            GovernanceEventPublisher eventPublisher,
            AuditService auditService,
            Clock clock,
            @Value("${sentientloop.policy.cache-ttl-seconds:30}") long cacheTtlSeconds) {
        this.policyConfigRepository = policyConfigRepository;
        this.eventPublisher = eventPublisher;
        this.auditService = auditService;
        this.clock = clock;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
    }

    public static String normalizeOrganization(String organizationId) {
        return organizationId == null || organizationId.isBlank() ? DEFAULT_ORGANIZATION : organizationId;
    }

    /**
     * Current policy of the organization, creating the defaults on first read.
     * Every call returns a private copy, so callers may edit it freely.
     */
    public PolicyConfig getPolicy(String organizationId) {
        String org = normalizeOrganization(organizationId);
        Instant now = clock.instant();
        CachedPolicy cached = cache.get(org);
        if (cached != null && cached.loadedAt().plus(cacheTtl).isAfter(now)) {
            return copyOf(cached.policy());
        }
        PolicyConfig policy = load(org);
        cache.put(org, new CachedPolicy(copyOf(policy), now));
        return policy;
    }

    /**
     * Replace the organization's policy.
     *
     * @param expectedVersion version the caller's edit was based on
     * @throws GovernanceValidationException  when the replacement is malformed
     * @throws PolicyVersionConflictException when another update won
     */
    public PolicyConfig updatePolicy(String organizationId, PolicyConfig replacement, long expectedVersion,
            String actor) {
        String org = normalizeOrganization(organizationId);
        List<String> violations = validate(replacement);
        if (!violations.isEmpty()) {
            throw new GovernanceValidationException(violations);
        }

        PolicyConfig current = load(org);
        if (current.getVersion() != expectedVersion) {
            throw new PolicyVersionConflictException(org, expectedVersion, current.getVersion());
        }

        PolicyConfig next = replacement.toBuilder()
                .id(current.getId())
                .organizationId(org)
                .version(expectedVersion + 1)
                .updatedAt(clock.instant())
                .updatedBy(actor)
                .build();

        PolicyConfig saved = policyConfigRepository.replaceIfVersionMatches(next, expectedVersion)
                .orElseThrow(() -> new PolicyVersionConflictException(org, expectedVersion,
                        load(org).getVersion()));

        cache.put(org, new CachedPolicy(copyOf(saved), clock.instant()));
        log.info("[POLICY] {} updated to version {} by {}", org, saved.getVersion(), actor);

        auditService.record(AuditEntityType.POLICY, org, "v" + expectedVersion, "v" + saved.getVersion(),
                actor, "Policy replaced", Map.of("active", saved.isActive()));
        eventPublisher.publish(GovernanceEventType.POLICY_UPDATED, org,
                Map.of("organizationId", org, "version", saved.getVersion()));
        return saved;
    }

    /**
     * Drop the cached copy, e.g. after another pod updated the policy.
     */
    public void evict(String organizationId) {
        if (cache.remove(normalizeOrganization(organizationId)) != null) {
            log.debug("[POLICY] Evicted cached policy of {}", organizationId);
        }
    }

    public List<String> validate(PolicyConfig policy) {
        List<String> violations = new ArrayList<>();
        if (policy == null) {
            violations.add("policy is required");
            return violations;
        }
        if (Double.isNaN(policy.getConfidenceThreshold())
                || policy.getConfidenceThreshold() < 0.0 || policy.getConfidenceThreshold() > 1.0) {
            violations.add("confidenceThreshold must be between 0 and 1");
        }
        if (policy.getEscalationTimeoutMinutes() <= 0) {
            violations.add("escalationTimeoutMinutes must be positive");
        } else if (policy.getEscalationTimeoutMinutes() > MAX_ESCALATION_TIMEOUT_MINUTES) {
            violations.add("escalationTimeoutMinutes must be at most " + MAX_ESCALATION_TIMEOUT_MINUTES);
        }
        if (policy.getAutoEscalateThreshold() == null) {
            violations.add("autoEscalateThreshold is required");
        }
        if (policy.getActionRules() != null) {
            policy.getActionRules().forEach((actionType, rule) -> {
                if (actionType == null || actionType.isBlank()) {
                    violations.add("actionRules keys must be non-empty");
                } else if (rule == null || rule.getCheckpointType() == null) {
                    violations.add("actionRules." + actionType + ".checkpointType is required");
                }
            });
        }
        if (policy.getNotifyUsers() == null || policy.getNotifyUsers().stream().anyMatch(u -> u == null || u.isBlank())) {
            violations.add("notifyUsers must be a list of non-empty identities");
        }
        if (policy.getCriticalEscalationPath() == null
                || policy.getCriticalEscalationPath().stream().anyMatch(r -> r == null || r.isBlank())) {
            violations.add("criticalEscalationPath must be a list of non-empty roles");
        }
        MemoryRetention retention = policy.getMemoryRetention();
        if (retention == null) {
            violations.add("memoryRetention is required");
        } else {
            if (retention.getShortTermDays() <= 0 || retention.getLongTermDays() <= 0
                    || retention.getCriticalDecisionDays() <= 0 || retention.getAuditTrailDays() <= 0) {
                violations.add("memoryRetention windows must be positive");
            } else if (retention.getShortTermDays() > retention.getLongTermDays()
                    || retention.getLongTermDays() > retention.getCriticalDecisionDays()) {
                violations.add("memoryRetention must satisfy shortTerm <= longTerm <= criticalDecision");
            }
        }
        return violations;
    }

    /**
     * Policy a new organization starts with.
     */
    public static PolicyConfig defaults(String organizationId) {
        Map<String, ActionRule> rules = new HashMap<>();
        rules.put("delete", ActionRule.builder()
                .alwaysCheck(true)
                .checkpointType(CheckpointType.CONFIRMATION_REQUIRED)
                .reason("Deletion operations require confirmation")
                .build());
        rules.put("payment", ActionRule.builder()
                .alwaysCheck(true)
                .checkpointType(CheckpointType.DECISION_REQUIRED)
                .reason("Payment operations require human decision")
                .build());
        rules.put("security", ActionRule.builder()
                .alwaysCheck(true)
                .checkpointType(CheckpointType.VALIDATION_REQUIRED)
                .reason("Security-related operations require validation")
                .build());

        return PolicyConfig.builder()
                .organizationId(organizationId)
                .version(0)
                .confidenceThreshold(0.7)
                .alwaysCheckHighImpact(true)
                .actionRules(rules)
                .autoEscalateThreshold(ImpactLevel.HIGH)
                .escalationTimeoutMinutes(60)
                .notifyUsers(new ArrayList<>(List.of("admin")))
                .criticalEscalationPath(new ArrayList<>(List.of("team-lead", "manager", "executive")))
                .memoryRetention(new MemoryRetention())
                .active(true)
                .build();
    }

    /**
     * Deep copy: rules, recipient lists and retention windows are not shared
     * with the source.
     */
    static PolicyConfig copyOf(PolicyConfig policy) {
        Map<String, ActionRule> rules = new HashMap<>();
        if (policy.getActionRules() != null) {
            policy.getActionRules().forEach((actionType, rule) -> rules.put(actionType,
                    rule == null ? null : rule.toBuilder().build()));
        }
        MemoryRetention retention = policy.getMemoryRetention();
        return policy.toBuilder()
                .actionRules(rules)
                .notifyUsers(policy.getNotifyUsers() != null ? new ArrayList<>(policy.getNotifyUsers()) : null)
                .criticalEscalationPath(policy.getCriticalEscalationPath() != null
                        ? new ArrayList<>(policy.getCriticalEscalationPath()) : null)
                .memoryRetention(retention != null ? retention.toBuilder().build() : null)
                .build();
    }

    private PolicyConfig load(String org) {
        return policyConfigRepository.findByOrganizationId(org).orElseGet(() -> createDefaults(org));
    }

    private PolicyConfig createDefaults(String org) {
        try {
            PolicyConfig created = policyConfigRepository.insert(defaults(org).toBuilder()
                    .updatedAt(clock.instant())
                    .updatedBy("system")
                    .build());
            log.info("[POLICY] Created default policy for {}", org);
            return created;
        } catch (DuplicateKeyException e) {
            return policyConfigRepository.findByOrganizationId(org).orElseThrow(() -> e);
        }
    }

    private record CachedPolicy(PolicyConfig policy, Instant loadedAt) {
    }
}
