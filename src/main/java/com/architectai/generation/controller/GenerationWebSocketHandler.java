package com.architectai.generation.controller;

import com.architectai.generation.model.NotificationEvent;
import com.architectai.generation.service.NotificationHub;
import com.architectai.generation.service.NotificationSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges WebSocket sessions on {@code /ws/{room_id}} to the {@link NotificationHub}.
 */
@Component
public class GenerationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(GenerationWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final NotificationHub notificationHub;
    private final ObjectMapper objectMapper;
    private final Map<String, SessionSubscriber> subscribers = new ConcurrentHashMap<>();

    public GenerationWebSocketHandler(NotificationHub notificationHub, ObjectMapper objectMapper) {
        this.notificationHub = notificationHub;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String roomId = roomOf(session.getUri());
        if (roomId == null) {
            logger.warn("Rejecting WebSocket session {} without a room id", session.getId());
            session.close(CloseStatus.BAD_DATA.withReason("room id required"));
            return;
        }
        SessionSubscriber subscriber = new SessionSubscriber(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT), roomId);
        subscribers.put(session.getId(), subscriber);
        notificationHub.subscribe(roomId, subscriber);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionSubscriber subscriber = subscribers.get(session.getId());
        if (subscriber != null) {
            notificationHub.handleClientMessage(subscriber.roomId, subscriber, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.debug("WebSocket session {} closed: {}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        SessionSubscriber subscriber = subscribers.remove(session.getId());
        if (subscriber != null) {
            notificationHub.disconnect(subscriber);
        }
    }

    /**
     * Last non-empty path segment, e.g. {@code gen_abc} for {@code /ws/gen_abc}.
     */
    static String roomOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int slash = path.lastIndexOf('/');
        String room = slash < 0 ? path : path.substring(slash + 1);
        return room.isBlank() || "ws".equals(room) ? null : room;
    }

    private final class SessionSubscriber implements NotificationSubscriber {

        private final WebSocketSession session;
        private final String roomId;

        private SessionSubscriber(WebSocketSession session, String roomId) {
            this.session = session;
            this.roomId = roomId;
        }

        @Override
        public String getId() {
            return session.getId();
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void send(NotificationEvent event) throws IOException {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        }
    }
}
