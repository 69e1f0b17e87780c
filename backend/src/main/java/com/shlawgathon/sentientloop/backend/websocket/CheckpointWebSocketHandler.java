package com.shlawgathon.sentientloop.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes checkpoint events to agents connected at /ws/checkpoints/{id}.
 * Disconnecting only drops the subscription; the checkpoint is untouched.
 */
@Component
public class CheckpointWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(CheckpointWebSocketHandler.class);

    private final ObjectMapper objectMapper;

    // checkpointId -> sessionId -> session
    private final Map<String, Map<String, WebSocketSession>> checkpointSessions = new ConcurrentHashMap<>();

    public CheckpointWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String checkpointId = extractCheckpointId(session);
        if (checkpointId != null) {
            checkpointSessions.computeIfAbsent(checkpointId, k -> new ConcurrentHashMap<>())
                    .put(session.getId(), session);
            log.info("WebSocket connected for checkpoint: {} session: {}", checkpointId, session.getId());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String checkpointId = extractCheckpointId(session);
        if (checkpointId != null) {
            checkpointSessions.computeIfPresent(checkpointId, (id, sessions) -> {
                sessions.remove(session.getId());
                return sessions.isEmpty() ? null : sessions;
            });
            log.info("WebSocket disconnected for checkpoint: {} session: {}", checkpointId, session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Received message: {}", message.getPayload());
    }

    /**
     * Relay an event received over Redis to the sessions on this pod.
     */
    public void broadcastFromPubSub(String checkpointId, WebSocketMessage message) {
        var sessions = checkpointSessions.get(checkpointId);
        if (sessions == null || sessions.isEmpty()) {
            return;
        }

        try {
            TextMessage textMessage = new TextMessage(objectMapper.writeValueAsString(message));
            sessions.values().forEach(session -> {
                try {
                    if (session.isOpen()) {
                        // Sessions are not safe for concurrent sends
                        synchronized (session) {
                            session.sendMessage(textMessage);
                        }
                    }
                } catch (IOException e) {
                    log.error("Failed to send WebSocket message to session: {}", session.getId(), e);
                }
            });
        } catch (Exception e) {
            log.error("Failed to broadcast message for checkpoint: {}", checkpointId, e);
        }
    }

    int sessionCount(String checkpointId) {
        var sessions = checkpointSessions.get(checkpointId);
        return sessions != null ? sessions.size() : 0;
    }

    private String extractCheckpointId(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        // Path format: /ws/checkpoints/{checkpointId}
        String[] parts = session.getUri().getPath().split("/");
        if (parts.length >= 4 && "checkpoints".equals(parts[2])) {
            return parts[3];
        }
        return null;
    }
}
