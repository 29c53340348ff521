package com.architectai.generation.controller;

import com.architectai.generation.TestClock;
import com.architectai.generation.model.NotificationEvent;
import com.architectai.generation.service.NotificationHub;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationWebSocketHandlerTest {

    @Mock
    private WebSocketSession session;

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private NotificationHub hub;
    private GenerationWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        hub = new NotificationHub(objectMapper, TestClock.at("2026-01-15T10:00:00Z"));
        handler = new GenerationWebSocketHandler(hub, objectMapper);
    }

    @Test
    void connectingToARoomSubscribesAndConfirms() throws Exception {
        openSession("gen_abc");

        handler.afterConnectionEstablished(session);

        JsonNode established = sentMessages().get(0);
        assertThat(established.path("type").asText()).isEqualTo("connection.established");
        assertThat(established.path("data").path("room_id").asText()).isEqualTo("gen_abc");
        assertThat(established.path("timestamp").asText()).startsWith("2026-01-15T10:00");
        assertThat(hub.connectionCount("gen_abc")).isEqualTo(1);
    }

    @Test
    void roomEventsAreForwardedAsJson() throws Exception {
        openSession("gen_abc");
        handler.afterConnectionEstablished(session);

        hub.publish("gen_abc", NotificationEvent.Type.GENERATION_PROGRESS, Map.of("job_id", "gen_abc", "progress", 40.0));

        JsonNode progress = sentMessages().get(1);
        assertThat(progress.path("type").asText()).isEqualTo("generation.progress");
        assertThat(progress.path("data").path("progress").asDouble()).isEqualTo(40.0);
    }

    @Test
    void pingIsAnsweredWithPong() throws Exception {
        openSession("gen_abc");
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        assertThat(sentMessages()).extracting(node -> node.path("type").asText())
                .containsExactly("connection.established", "pong");
    }

    @Test
    void closingTheSessionLeavesTheHub() throws Exception {
        openSession("gen_abc");
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(hub.connectionCount()).isZero();
    }

    @Test
    void sessionWithoutRoomIsClosed() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/ws/"));
        when(session.getId()).thenReturn("s1");

        handler.afterConnectionEstablished(session);

        verify(session).close(any(CloseStatus.class));
        verify(session, never()).sendMessage(any());
        assertThat(hub.connectionCount()).isZero();
    }

    @Test
    void roomIsTheLastPathSegment() {
        assertThat(GenerationWebSocketHandler.roomOf(URI.create("ws://host/ws/gen_1"))).isEqualTo("gen_1");
        assertThat(GenerationWebSocketHandler.roomOf(URI.create("ws://host/ws"))).isNull();
        assertThat(GenerationWebSocketHandler.roomOf(null)).isNull();
    }

    private void openSession(String room) {
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8000/ws/" + room));
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<JsonNode> sentMessages() throws Exception {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream()
                .map(message -> {
                    try {
                        return objectMapper.readTree(((TextMessage) message).getPayload());
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                })
                .collect(Collectors.toList());
    }
}
