package io.github.drompincen.complianceboard.protocol.api;

public record RelationRequest(String relatedDocumentId, String relationType) {}
