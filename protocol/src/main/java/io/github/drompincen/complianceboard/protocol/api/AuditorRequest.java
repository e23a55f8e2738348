package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Create or partial-update payload for an auditor. On update, null fields keep their current value.
 */
public record AuditorRequest(
        String name,
        String description,
        String schedule,
        @JsonProperty("isActive") Boolean isActive,
        String documentId,
        AuditorInstructions instructions
) {}
