package io.github.drompincen.complianceboard.protocol.api;

public record DocumentSummaryDto(
        String id,
        String title,
        String pageKind,
        Integer relevanceScore
) {}
