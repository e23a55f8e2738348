package io.github.drompincen.complianceboard.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_PROJECT,
    UNSUBSCRIBE,

    // Server -> Client
    PROJECT_CHANGED,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
