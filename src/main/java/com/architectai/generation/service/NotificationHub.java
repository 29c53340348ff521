package com.architectai.generation.service;

import com.architectai.generation.model.NotificationEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans job events out to real-time subscribers grouped in rooms (one room per job id, or any
 * session id a client picks).
 *
 * Delivery is best effort and at most once: there is no replay for late joiners, and a
 * subscriber whose send fails is dropped. Pollers of {@link JobRegistry} are the authoritative
 * fallback. The hub never reads or writes job or version state itself.
 */
@Service
public class NotificationHub {

    private static final Logger logger = LoggerFactory.getLogger(NotificationHub.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ConcurrentHashMap<String, Set<NotificationSubscriber>> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<NotificationSubscriber, Set<String>> memberships = new ConcurrentHashMap<>();

    public NotificationHub(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Confirms the connection to the subscriber, then adds it to the room. Room events are only
     * delivered after the confirmation; a subscriber that cannot take the confirmation never joins.
     */
    public void subscribe(String roomId, NotificationSubscriber subscriber) {
        if (!StringUtils.hasText(roomId)) {
            throw new ValidationException("room_id is required");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("room_id", roomId);
        data.put("connection_id", subscriber.getId());
        if (!deliver(subscriber, event(NotificationEvent.Type.CONNECTION_ESTABLISHED, data))) {
            return;
        }
        join(roomId, subscriber);
        logger.info("Subscriber {} connected to room '{}' (total connections: {})", subscriber.getId(), roomId, connectionCount());
    }

    public void unsubscribe(String roomId, NotificationSubscriber subscriber) {
        Set<String> joined = memberships.get(subscriber);
        if (joined != null) {
            joined.remove(roomId);
        }
        leave(roomId, subscriber);
    }

    /**
     * Removes a subscriber from every room it joined. Only live delivery is lost; no job state changes.
     */
    public void disconnect(NotificationSubscriber subscriber) {
        Set<String> joined = memberships.remove(subscriber);
        if (joined == null) {
            return;
        }
        for (String roomId : joined) {
            leave(roomId, subscriber);
        }
        logger.info("Subscriber {} disconnected (remaining connections: {})", subscriber.getId(), connectionCount());
    }

    public void publish(String roomId, NotificationEvent.Type type, Map<String, Object> data) {
        publish(roomId, event(type, data));
    }

    /**
     * Sends an event to everyone currently in the room. Subscribers that joined later never see it.
     */
    public void publish(String roomId, NotificationEvent event) {
        Set<NotificationSubscriber> members = rooms.get(roomId);
        if (members == null || members.isEmpty()) {
            logger.debug("No subscribers in room '{}' for {}", roomId, event.getType().getWireName());
            return;
        }
        for (NotificationSubscriber subscriber : new ArrayList<>(members)) {
            deliver(subscriber, event);
        }
    }

    /**
     * Handles a text frame sent by a client: {@code ping}, {@code subscribe} and {@code unsubscribe}.
     */
    public void handleClientMessage(String roomId, NotificationSubscriber subscriber, String payload) {
        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.warn("Invalid JSON from room '{}': {}", roomId, payload);
            sendError(subscriber, "Invalid JSON message");
            return;
        }
        if (message == null || !message.isObject()) {
            sendError(subscriber, "Message must be a JSON object");
            return;
        }

        String type = message.path("type").asText("");
        switch (type) {
            case "ping" -> deliver(subscriber, event(NotificationEvent.Type.PONG, Collections.emptyMap()));
            case "subscribe" -> roomsOf(message).forEach(room -> join(room, subscriber));
            case "unsubscribe" -> roomsOf(message).forEach(room -> unsubscribe(room, subscriber));
            default -> logger.debug("Ignoring message of type '{}' from room '{}'", type, roomId);
        }
    }

    @Scheduled(fixedDelayString = "${app.notifications.heartbeat-ms:30000}",
            initialDelayString = "${app.notifications.heartbeat-ms:30000}")
    public void sendHeartbeats() {
        if (memberships.isEmpty()) {
            return;
        }
        NotificationEvent heartbeat = event(NotificationEvent.Type.HEARTBEAT, Collections.emptyMap());
        for (NotificationSubscriber subscriber : new ArrayList<>(memberships.keySet())) {
            deliver(subscriber, heartbeat);
        }
    }

    public int connectionCount() {
        return memberships.size();
    }

    public int connectionCount(String roomId) {
        Set<NotificationSubscriber> members = rooms.get(roomId);
        return members == null ? 0 : members.size();
    }

    public NotificationEvent event(NotificationEvent.Type type, Map<String, Object> data) {
        return new NotificationEvent(type, data, OffsetDateTime.now(clock));
    }

    private void join(String roomId, NotificationSubscriber subscriber) {
        if (!StringUtils.hasText(roomId)) {
            throw new ValidationException("room_id is required");
        }
        rooms.computeIfAbsent(roomId, id -> ConcurrentHashMap.newKeySet()).add(subscriber);
        memberships.computeIfAbsent(subscriber, s -> ConcurrentHashMap.newKeySet()).add(roomId);
    }

    private void leave(String roomId, NotificationSubscriber subscriber) {
        rooms.computeIfPresent(roomId, (id, members) -> {
            members.remove(subscriber);
            return members.isEmpty() ? null : members;
        });
    }

    private boolean deliver(NotificationSubscriber subscriber, NotificationEvent event) {
        if (!subscriber.isOpen()) {
            disconnect(subscriber);
            return false;
        }
        try {
            subscriber.send(event);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Dropping subscriber {} after failed {} delivery: {}",
                    subscriber.getId(), event.getType().getWireName(), e.getMessage());
            disconnect(subscriber);
            return false;
        }
    }

    private void sendError(NotificationSubscriber subscriber, String message) {
        deliver(subscriber, event(NotificationEvent.Type.ERROR, Map.of("message", message)));
    }

    private List<String> roomsOf(JsonNode message) {
        List<String> requested = new ArrayList<>();
        for (JsonNode room : message.path("rooms")) {
            if (room.isTextual() && StringUtils.hasText(room.asText())) {
                requested.add(room.asText());
            }
        }
        return requested;
    }
}
