package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record EvidenceDto(
        String id,
        String documentId,
        String name,
        String description,
        String valueType,
        JsonNode value,
        EvidenceCollectionDto collection,
        Instant createdAt
) {
    public record EvidenceCollectionDto(String id, String name, String content) {}

    @JsonIgnore
    public boolean isCollection() {
        return collection != null;
    }
}
