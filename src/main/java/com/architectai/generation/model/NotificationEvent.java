package com.architectai.generation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed message pushed to real-time subscribers, serialized as {@code {type, data, timestamp}}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NotificationEvent {

    public enum Type {
        CONNECTION_ESTABLISHED("connection.established"),
        PONG("pong"),
        HEARTBEAT("heartbeat"),
        JOB_STATUS("job.status"),
        GENERATION_PROGRESS("generation.progress"),
        GENERATION_COMPLETE("generation.complete"),
        GENERATION_ERROR("generation.error"),
        ERROR("error");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    private final Type type;
    private final Map<String, Object> data;
    private final OffsetDateTime timestamp;

    public NotificationEvent(Type type, Map<String, Object> data, OffsetDateTime timestamp) {
        this.type = type;
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.timestamp = timestamp;
    }

    public boolean isTerminal() {
        return type == Type.GENERATION_COMPLETE || type == Type.GENERATION_ERROR;
    }

    @Override
    public String toString() {
        return type.getWireName() + data;
    }
}
