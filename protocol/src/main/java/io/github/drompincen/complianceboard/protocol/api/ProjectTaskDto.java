package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.LocalDate;

public record ProjectTaskDto(
        String id,
        String projectId,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        LocalDate dueDate,
        String resolutionReason,
        Instant resolutionDate,
        String notes,
        String dependsOnTaskId,
        String documentId,
        String evidenceRequestId,
        Instant createdAt,
        Instant updatedAt
) {
    public enum TaskStatus {
        TODO("todo"), IN_PROGRESS("in-progress"), STUCK("stuck"), COMPLETED("completed");

        private final String wire;

        TaskStatus(String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static TaskStatus fromWire(String value) {
            if (value == null) return null;
            String v = value.trim().toLowerCase().replace('_', '-');
            for (TaskStatus s : values()) {
                if (s.wire.equals(v)) return s;
            }
            throw new IllegalArgumentException("Invalid status. Allowed: todo, in-progress, stuck, completed");
        }
    }

    public enum TaskPriority {
        LOW, MEDIUM, HIGH, CRITICAL;

        @JsonValue
        public String wire() { return name().toLowerCase(); }

        @JsonCreator
        public static TaskPriority fromWire(String value) {
            if (value == null) return null;
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid priority. Allowed: low, medium, high, critical");
            }
        }
    }

    public ProjectTaskDto withStatus(TaskStatus newStatus, String reason, Instant resolvedAt, Instant now) {
        return new ProjectTaskDto(id, projectId, title, description, newStatus, priority, dueDate,
                reason, resolvedAt, notes, dependsOnTaskId, documentId, evidenceRequestId, createdAt, now);
    }
}
