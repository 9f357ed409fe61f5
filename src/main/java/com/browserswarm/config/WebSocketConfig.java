package com.browserswarm.config;

import com.browserswarm.stream.StatusWebSocketHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {

    private final StatusWebSocketHandler statusWebSocketHandler;

    public WebSocketConfig(StatusWebSocketHandler statusWebSocketHandler) {
        this.statusWebSocketHandler = statusWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(statusWebSocketHandler, "/ws/swarm")
                .setAllowedOrigins("*");
    }
}
