package io.github.drompincen.complianceboard.protocol.api;

import java.util.List;

public record FullDocumentDto(
        DocumentPageDto document,
        List<EvidenceDto> evidence,
        List<EvidenceRequestDto> evidenceRequests,
        List<DocumentPageDto> children,
        List<RelatedPageSummary> relatedPages
) {}
