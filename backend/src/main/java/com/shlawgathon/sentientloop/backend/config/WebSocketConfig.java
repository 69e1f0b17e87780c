package com.shlawgathon.sentientloop.backend.config;

import com.shlawgathon.sentientloop.backend.websocket.CheckpointWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CheckpointWebSocketHandler checkpointWebSocketHandler;

    public WebSocketConfig(CheckpointWebSocketHandler checkpointWebSocketHandler) {
        this.checkpointWebSocketHandler = checkpointWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Agents waiting on a checkpoint (no session auth, same trust as /internal)
        registry.addHandler(checkpointWebSocketHandler, "/ws/checkpoints/{checkpointId}")
                .setAllowedOrigins("*");
    }
}
