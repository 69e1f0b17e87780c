package com.shlawgathon.sentientloop.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.sentientloop.backend.config.RedisMessageConfig;
import com.shlawgathon.sentientloop.backend.exception.ExternalDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes notification requests on a Redis channel for the transport
 * workers. A SETNX marker per idempotency key suppresses duplicate pages.
 */
@Component
public class RedisNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationGateway.class);

    static final String DEDUPE_KEY_PREFIX = "sentientloop:notified:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration dedupeTtl;

    public RedisNotificationGateway(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${sentientloop.notification.dedupe-ttl-hours:24}") long dedupeTtlHours) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.dedupeTtl = Duration.ofHours(dedupeTtlHours);
    }

    @Override
    public boolean notify(List<String> parties, String subject, Map<String, Object> context, String idempotencyKey) {
        String markerKey = DEDUPE_KEY_PREFIX + idempotencyKey;
        Boolean first = redisTemplate.opsForValue().setIfAbsent(markerKey, "1", dedupeTtl);
        if (!Boolean.TRUE.equals(first)) {
            log.debug("[NOTIFY] Already delivered {}, skipping", idempotencyKey);
            return false;
        }

        try {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("idempotencyKey", idempotencyKey);
            message.put("parties", parties);
            message.put("subject", subject);
            message.put("context", context);
            redisTemplate.convertAndSend(RedisMessageConfig.NOTIFICATIONS_CHANNEL,
                    objectMapper.writeValueAsString(message));
            log.info("[NOTIFY] {} -> {}", subject, parties);
            return true;
        } catch (Exception e) {
            // Release the marker so a retry can deliver
            redisTemplate.delete(markerKey);
            throw new ExternalDependencyException("Notification " + idempotencyKey + " failed", e);
        }
    }
}
