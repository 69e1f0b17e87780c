package com.shlawgathon.sentientloop.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.sentientloop.backend.service.PolicyService;
import com.shlawgathon.sentientloop.backend.service.ResolutionWaiters;
import com.shlawgathon.sentientloop.backend.websocket.CheckpointWebSocketHandler;
import com.shlawgathon.sentientloop.backend.websocket.WebSocketMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Subscribes to governance events. Each pod receives every event and
 * <ul>
 * <li>relays checkpoint events to its local WebSocket sessions,</li>
 * <li>wakes local {@code awaitResolution} callers,</li>
 * <li>drops its cached policy on {@code policy.updated}.</li>
 * </ul>
 */
@Component
public class GovernanceEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEventSubscriber.class);

    private final ObjectMapper objectMapper;
    private final CheckpointWebSocketHandler checkpointWebSocketHandler;
    private final ResolutionWaiters resolutionWaiters;
    private final PolicyService policyService;

    public GovernanceEventSubscriber(
            ObjectMapper objectMapper,
            CheckpointWebSocketHandler checkpointWebSocketHandler,
            ResolutionWaiters resolutionWaiters,
            PolicyService policyService) {
        this.objectMapper = objectMapper;
        this.checkpointWebSocketHandler = checkpointWebSocketHandler;
        this.resolutionWaiters = resolutionWaiters;
        this.policyService = policyService;
    }

    /**
     * Handle incoming Redis Pub/Sub message.
     * Called by Spring's MessageListenerAdapter.
     */
    public void handleMessage(String message) {
        try {
            var event = objectMapper.readValue(message, GovernanceEventPublisher.GovernanceEventMessage.class);
            GovernanceEventType eventType = event.eventType();
            Map<String, Object> payload = event.payload() != null ? event.payload() : Map.of();

            log.debug("[PUB/SUB] Received {} for {}", eventType.getWireName(), event.entityId());

            if (eventType == GovernanceEventType.POLICY_UPDATED) {
                policyService.evict(event.entityId());
                return;
            }

            Object checkpointId = payload.get("checkpointId");
            if (checkpointId == null) {
                return;
            }

            WebSocketMessage wsMessage = WebSocketMessage.builder()
                    .type(eventType.getWireName())
                    .checkpointId(checkpointId.toString())
                    .data(payload)
                    .build();
            checkpointWebSocketHandler.broadcastFromPubSub(checkpointId.toString(), wsMessage);

            if (eventType.endsCheckpointWait()) {
                resolutionWaiters.signal(checkpointId.toString());
            }
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to process message: {}", message, e);
        }
    }
}
