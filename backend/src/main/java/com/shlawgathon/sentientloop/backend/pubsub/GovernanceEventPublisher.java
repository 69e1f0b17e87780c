package com.shlawgathon.sentientloop.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.sentientloop.backend.config.RedisMessageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes governance events to Redis Pub/Sub for distribution across all
 * backend pods.
 */
@Component
public class GovernanceEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public GovernanceEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish an event. Best effort: the state change it describes is already
     * committed, so failures are logged and dropped.
     *
     * @param eventType the event type
     * @param entityId  checkpoint, failure or organization id the event is about
     * @param payload   event data
     */
    public void publish(GovernanceEventType eventType, String entityId, Map<String, Object> payload) {
        try {
            GovernanceEventMessage message = new GovernanceEventMessage(entityId, eventType, payload);
            String json = objectMapper.writeValueAsString(message);

            redisTemplate.convertAndSend(RedisMessageConfig.GOVERNANCE_EVENTS_CHANNEL, json);
            log.debug("[PUB/SUB] Published {} for {}", eventType.getWireName(), entityId);
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to publish {} for {}", eventType.getWireName(), entityId, e);
        }
    }

    /**
     * Message wrapper for Redis Pub/Sub.
     */
    public record GovernanceEventMessage(String entityId, GovernanceEventType eventType,
            Map<String, Object> payload) {
    }
}
