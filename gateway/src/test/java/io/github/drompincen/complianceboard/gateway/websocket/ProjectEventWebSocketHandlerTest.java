package io.github.drompincen.complianceboard.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectEventWebSocketHandlerTest {

    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketSession wsSession2;

    private ObjectMapper objectMapper;
    private ProjectEventPublisher events;
    private ProjectEventWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        events = new ProjectEventPublisher();
        handler = new ProjectEventWebSocketHandler(objectMapper, events);
        handler.init();
        when(wsSession.isOpen()).thenReturn(true);
        when(wsSession2.isOpen()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        handler.shutdown();
    }

    @Test
    void subscribeProjectSendsAckWithCurrentSeq() throws Exception {
        events.emit("p1", ChangeEvent.EntityType.TASK, "t1", ChangeEvent.Action.CREATED, ChangeEvent.Origin.USER);

        subscribe(wsSession, "p1");

        JsonNode ack = lastMessage(wsSession);
        assertThat(ack.path("type").asText()).isEqualTo("SUBSCRIBED");
        assertThat(ack.path("projectId").asText()).isEqualTo("p1");
        assertThat(ack.path("payload").path("seq").asLong()).isEqualTo(1);
    }

    @Test
    void changeEventsReachOnlyProjectSubscribers() throws Exception {
        subscribe(wsSession, "p1");
        subscribe(wsSession2, "p2");
        clearInvocations(wsSession, wsSession2);

        events.emit("p1", ChangeEvent.EntityType.AUDIT_REPORT, "rep-1", ChangeEvent.Action.RUN_COMPLETED,
                ChangeEvent.Origin.SCHEDULER);

        JsonNode pushed = lastMessage(wsSession);
        assertThat(pushed.path("type").asText()).isEqualTo("PROJECT_CHANGED");
        assertThat(pushed.path("payload").path("entityId").asText()).isEqualTo("rep-1");
        assertThat(pushed.path("payload").path("action").asText()).isEqualTo("RUN_COMPLETED");
        verify(wsSession2, never()).sendMessage(any());
    }

    @Test
    void unsubscribeAndCloseStopDelivery() throws Exception {
        subscribe(wsSession, "p1");
        subscribe(wsSession2, "p1");
        handler.handleTextMessage(wsSession, json(Map.of("type", "UNSUBSCRIBE", "projectId", "p1")));
        handler.afterConnectionClosed(wsSession2, CloseStatus.NORMAL);

        assertThat(handler.subscriberCount("p1")).isZero();
    }

    @Test
    void failingSocketDoesNotBlockOthers() throws Exception {
        subscribe(wsSession, "p1");
        subscribe(wsSession2, "p1");
        doThrow(new IOException("broken pipe")).when(wsSession).sendMessage(any());
        clearInvocations(wsSession2);

        events.emit("p1", ChangeEvent.EntityType.DOCUMENT, "d1", ChangeEvent.Action.DELETED, ChangeEvent.Origin.USER);

        verify(wsSession2).sendMessage(any());
    }

    @Test
    void missingProjectIdIsAnError() throws Exception {
        handler.handleTextMessage(wsSession, json(Map.of("type", "SUBSCRIBE_PROJECT")));

        assertThat(lastMessage(wsSession).path("type").asText()).isEqualTo("ERROR");
        assertThat(handler.subscriberCount("p1")).isZero();
    }

    private void subscribe(WebSocketSession session, String projectId) throws Exception {
        handler.handleTextMessage(session, json(Map.of("type", "SUBSCRIBE_PROJECT", "projectId", projectId)));
    }

    private TextMessage json(Map<String, String> body) throws Exception {
        return new TextMessage(objectMapper.writeValueAsString(body));
    }

    private JsonNode lastMessage(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return objectMapper.readTree(captor.getValue().getPayload());
    }
}
