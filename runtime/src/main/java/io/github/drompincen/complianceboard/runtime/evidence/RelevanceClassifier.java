package io.github.drompincen.complianceboard.runtime.evidence;

import io.github.drompincen.complianceboard.protocol.api.RelevanceCategory;
import io.github.drompincen.complianceboard.protocol.api.RelevanceClassification;

import java.util.Optional;

/**
 * Buckets a 0-100 relevance score into one of four categories. Bands are closed on both ends for
 * integer scores (0-14, 15-49, 50-79, 80-100); fractional scores fall into the band below the next
 * boundary. Scores outside 0-100 are clamped.
 */
public final class RelevanceClassifier {

    private RelevanceClassifier() {}

    public static Optional<RelevanceClassification> classify(Integer score) {
        return score == null ? Optional.empty() : classify(score.doubleValue());
    }

    public static Optional<RelevanceClassification> classify(Double score) {
        if (score == null || score.isNaN()) return Optional.empty();
        return Optional.of(RelevanceClassification.of(category(score)));
    }

    public static RelevanceCategory category(double score) {
        double s = Math.max(0, Math.min(100, score));
        if (s < 15) return RelevanceCategory.NOT_IMMEDIATELY_RELEVANT;
        if (s < 50) return RelevanceCategory.LOW;
        if (s < 80) return RelevanceCategory.MEDIUM;
        return RelevanceCategory.HIGH;
    }
}
