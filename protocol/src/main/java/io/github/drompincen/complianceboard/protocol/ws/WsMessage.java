package io.github.drompincen.complianceboard.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String projectId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String projectId, JsonNode payload) {
        return new WsMessage(type, projectId, payload, Instant.now());
    }

    public static WsMessage error(String projectId, JsonNode payload) {
        return of(WsMessageType.ERROR, projectId, payload);
    }
}
