package io.github.drompincen.complianceboard.client.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.complianceboard.client.state.RefreshTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Listens on the gateway's {@code /ws} socket for one project and bumps a {@link RefreshTrigger} on every
 * {@code PROJECT_CHANGED} message. Reconnects after the socket closes.
 */
public class ProjectChangeSocket implements WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(ProjectChangeSocket.class);

    private final ClientSettings settings;
    private final String projectId;
    private final RefreshTrigger refreshTrigger;
    private final StringBuilder buffer = new StringBuilder();
    private volatile WebSocket ws;
    private volatile boolean closed;

    public ProjectChangeSocket(ClientSettings settings, String projectId, RefreshTrigger refreshTrigger) {
        this.settings = settings;
        this.projectId = projectId;
        this.refreshTrigger = refreshTrigger;
    }

    public void connect() {
        String wsUrl = settings.baseUrl().toString().replaceAll("/+$", "")
                .replace("http://", "ws://").replace("https://", "wss://") + "/ws";
        HttpClient.newHttpClient().newWebSocketBuilder()
                .buildAsync(URI.create(wsUrl), this)
                .exceptionally(ex -> {
                    log.warn("Change socket connect failed: {}", ex.getMessage());
                    return null;
                });
    }

    public void close() {
        closed = true;
        WebSocket socket = ws;
        if (socket != null) socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        this.ws = webSocket;
        webSocket.sendText(subscribeMessage(), true);
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            handleMessage(buffer.toString());
            buffer.setLength(0);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        ws = null;
        if (!closed) {
            log.info("Change socket closed ({}), reconnecting", statusCode);
            CompletableFuture.delayedExecutor(2, TimeUnit.SECONDS).execute(this::connect);
        }
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.warn("Change socket error: {}", error.getMessage());
    }

    String subscribeMessage() {
        return HttpComplianceApi.MAPPER.createObjectNode()
                .put("type", "SUBSCRIBE_PROJECT")
                .put("projectId", projectId)
                .toString();
    }

    /** Returns true when the message triggered a refresh. */
    boolean handleMessage(String raw) {
        try {
            JsonNode node = HttpComplianceApi.MAPPER.readTree(raw);
            String type = node.path("type").asText();
            if ("ERROR".equals(type)) {
                log.warn("Change socket error for project {}: {}", projectId, node.path("payload").path("message").asText());
                return false;
            }
            if (!"PROJECT_CHANGED".equals(type) || !projectId.equals(node.path("projectId").asText())) return false;
            long version = refreshTrigger.trigger();
            log.debug("Project {} changed ({} {}), refresh version {}", projectId,
                    node.path("payload").path("entityType").asText(), node.path("payload").path("action").asText(),
                    version);
            return true;
        } catch (Exception e) {
            log.warn("Unreadable change socket message: {}", e.getMessage());
            return false;
        }
    }
}
