package com.architectai.generation.controller;

import com.architectai.generation.model.NotificationEvent;
import com.architectai.generation.service.NotificationHub;
import com.architectai.generation.service.NotificationSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Relays the events of one job to a Server-Sent Events response. The stream ends with the job's
 * {@code generation.complete} or {@code generation.error} event.
 */
class GenerationStreamSubscriber implements NotificationSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(GenerationStreamSubscriber.class);

    private final String id = "sse-" + UUID.randomUUID();
    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;
    private final NotificationHub notificationHub;
    private volatile boolean open = true;

    GenerationStreamSubscriber(SseEmitter emitter, ObjectMapper objectMapper, NotificationHub notificationHub) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.notificationHub = notificationHub;
        emitter.onCompletion(this::close);
        emitter.onTimeout(() -> {
            logger.warn("Generation stream {} timed out", id);
            close();
        });
        emitter.onError(error -> {
            logger.warn("Generation stream {} failed: {}", id, error.getMessage());
            close();
        });
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(NotificationEvent event) throws IOException {
        synchronized (emitter) {
            emitter.send(SseEmitter.event()
                    .name(event.getType().getWireName())
                    .data(objectMapper.writeValueAsString(event)));
        }
        if (event.isTerminal()) {
            emitter.complete();
            close();
        }
    }

    /**
     * Ends a stream whose request was refused before a job existed.
     */
    void reject(String error, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put("message", message);
        try {
            send(notificationHub.event(NotificationEvent.Type.GENERATION_ERROR, data));
        } catch (IOException e) {
            logger.warn("Could not deliver rejection to generation stream {}: {}", id, e.getMessage());
            emitter.completeWithError(e);
        }
    }

    private void close() {
        if (open) {
            open = false;
            notificationHub.disconnect(this);
        }
    }
}
