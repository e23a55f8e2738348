package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record DocumentPageDto(
        String id,
        String parentId,
        String title,
        String content,
        int order,
        Instant createdAt,
        Instant updatedAt,
        String pageKind,
        @JsonProperty("isControl") Boolean isControl,
        String scfId,
        List<String> frameworks,
        List<FrameworkMapping> frameworkMappings,
        Integer relevanceScore,
        String status,
        List<DocumentPageDto> children
) {
    public static final String KIND_CONTROL = "control";
    public static final String KIND_RISK = "risk";
    public static final String KIND_THREAT = "threat";

    public record FrameworkMapping(String framework, List<String> externalIds) {}

    @JsonIgnore
    public boolean isLeaf() {
        return children == null || children.isEmpty();
    }
}
