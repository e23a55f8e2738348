package io.github.drompincen.complianceboard.protocol.api;

import java.time.Instant;
import java.time.LocalDate;

public record EvidenceRequestDto(
        String id,
        String documentId,
        String title,
        String description,
        String status,
        LocalDate dueDate,
        Instant createdAt
) {
    public enum Bucket {
        COMPLETED, OVERDUE, IN_PROGRESS, OTHER
    }
}
