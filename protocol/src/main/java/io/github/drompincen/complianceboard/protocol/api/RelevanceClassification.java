package io.github.drompincen.complianceboard.protocol.api;

public record RelevanceClassification(RelevanceCategory category, String label) {

    public static RelevanceClassification of(RelevanceCategory category) {
        return new RelevanceClassification(category, category.label());
    }
}
