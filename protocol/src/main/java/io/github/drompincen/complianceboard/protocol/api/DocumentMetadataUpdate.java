package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Partial update of a documentation page. Null fields are left untouched.
 */
public record DocumentMetadataUpdate(
        String title,
        String content,
        String pageKind,
        @JsonProperty("isControl") Boolean isControl,
        String scfId,
        List<String> frameworks,
        List<DocumentPageDto.FrameworkMapping> frameworkMappings,
        Integer relevanceScore,
        String status
) {}
