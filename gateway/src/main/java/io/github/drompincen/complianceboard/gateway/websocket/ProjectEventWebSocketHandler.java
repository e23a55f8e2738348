package io.github.drompincen.complianceboard.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.protocol.ws.WsMessage;
import io.github.drompincen.complianceboard.protocol.ws.WsMessageType;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.Disposable;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes {@code PROJECT_CHANGED} messages to sockets subscribed to a project. Clients treat every message as a
 * refresh trigger for the views of that project.
 */
@Component
public class ProjectEventWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProjectEventWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ProjectEventPublisher events;
    private final Map<String, Set<WebSocketSession>> projectSubscriptions = new ConcurrentHashMap<>();
    private Disposable subscription;

    public ProjectEventWebSocketHandler(ObjectMapper objectMapper, ProjectEventPublisher events) {
        this.objectMapper = objectMapper;
        this.events = events;
    }

    @PostConstruct
    public void init() {
        subscription = events.events().subscribe(this::onEvent,
                e -> log.error("Change event stream failed", e));
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) subscription.dispose();
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        projectSubscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String projectId = node.path("projectId").asText(null);

        if (projectId == null || projectId.isBlank()) {
            send(session, WsMessage.error(null, objectMapper.createObjectNode().put("message", "projectId is required")));
            return;
        }
        if (WsMessageType.SUBSCRIBE_PROJECT.name().equals(type)) {
            projectSubscriptions.computeIfAbsent(projectId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, projectId,
                    objectMapper.createObjectNode().put("seq", events.currentSeq(projectId))));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            Set<WebSocketSession> subscribers = projectSubscriptions.get(projectId);
            if (subscribers != null) subscribers.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, projectId, null));
        } else {
            send(session, WsMessage.error(projectId,
                    objectMapper.createObjectNode().put("message", "Unknown message type: " + type)));
        }
    }

    void onEvent(ChangeEvent event) {
        Set<WebSocketSession> subscribers = projectSubscriptions.get(event.projectId());
        if (subscribers == null || subscribers.isEmpty()) return;
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(new WsMessage(WsMessageType.PROJECT_CHANGED,
                    event.projectId(), objectMapper.valueToTree(event), event.timestamp())));
        } catch (Exception e) {
            log.error("Could not serialize change event {} for project {}", event.seq(), event.projectId(), e);
            return;
        }
        for (WebSocketSession ws : subscribers) {
            if (!ws.isOpen()) continue;
            try {
                synchronized (ws) {
                    ws.sendMessage(message);
                }
            } catch (IOException e) {
                log.debug("Dropped change event {} for socket {}: {}", event.seq(), ws.getId(), e.getMessage());
            }
        }
    }

    int subscriberCount(String projectId) {
        Set<WebSocketSession> subscribers = projectSubscriptions.get(projectId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }
    }
}
