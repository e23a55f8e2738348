package io.github.drompincen.complianceboard.protocol.event;

import java.time.Instant;

/**
 * Notification that something in a project changed. {@code seq} increases monotonically per project.
 */
public record ChangeEvent(
        String projectId,
        long seq,
        EntityType entityType,
        String entityId,
        Action action,
        Origin origin,
        Instant timestamp
) {
    public enum EntityType {
        DOCUMENT, EVIDENCE, EVIDENCE_REQUEST, AUDITOR, AUDIT_REPORT, TASK
    }

    public enum Action {
        CREATED, UPDATED, DELETED, RUN_STARTED, RUN_COMPLETED
    }

    public enum Origin {
        USER, ASSISTANT, SCHEDULER
    }
}
