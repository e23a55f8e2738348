package io.github.drompincen.complianceboard.protocol.api;

/**
 * One row of a page's combined evidence list: either an open request or a collected item.
 */
public record EvidenceEntry(
        Kind kind,
        EvidenceRequestDto request,
        EvidenceDto evidence
) {
    public enum Kind {
        REQUEST, EVIDENCE
    }

    public static EvidenceEntry of(EvidenceRequestDto request) {
        return new EvidenceEntry(Kind.REQUEST, request, null);
    }

    public static EvidenceEntry of(EvidenceDto evidence) {
        return new EvidenceEntry(Kind.EVIDENCE, null, evidence);
    }

    public String id() {
        return kind == Kind.REQUEST ? request.id() : evidence.id();
    }
}
