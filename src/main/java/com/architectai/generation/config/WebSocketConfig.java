package com.architectai.generation.config;

import com.architectai.generation.controller.GenerationWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes job notifications at {@code /ws/{room_id}}, where the room is usually a job id.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final String allowedOrigins;
    private final GenerationWebSocketHandler generationWebSocketHandler;

    public WebSocketConfig(@Value("${app.cors.allowed-origins:*}") String allowedOrigins,
                           GenerationWebSocketHandler generationWebSocketHandler) {
        this.allowedOrigins = allowedOrigins;
        this.generationWebSocketHandler = generationWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(generationWebSocketHandler, "/ws/*")
                .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"));
    }
}
