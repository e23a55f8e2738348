package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AuditorDto(
        String id,
        String projectId,
        String documentId,
        String name,
        String description,
        @JsonProperty("isActive") boolean isActive,
        String schedule,
        int runCount,
        Instant lastRunAt,
        Instant nextRunAt,
        String lastStatus,
        AuditorInstructions instructions,
        Instant createdAt,
        Instant updatedAt
) {}
