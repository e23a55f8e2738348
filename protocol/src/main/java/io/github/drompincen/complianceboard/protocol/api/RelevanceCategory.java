package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelevanceCategory {
    NOT_IMMEDIATELY_RELEVANT("not_immediately_relevant", "Not Immediately Relevant"),
    LOW("low", "Low Relevance"),
    MEDIUM("medium", "Medium Relevance"),
    HIGH("high", "High Relevance");

    private final String key;
    private final String label;

    RelevanceCategory(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String key() { return key; }

    public String label() { return label; }
}
