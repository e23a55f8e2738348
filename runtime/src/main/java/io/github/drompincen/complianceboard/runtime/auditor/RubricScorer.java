package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.AuditorInstructions;
import io.github.drompincen.complianceboard.protocol.api.RequirementOutcome;
import io.github.drompincen.complianceboard.protocol.api.RubricResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Weighted rubric aggregation. Only evaluated requirements count toward the total weight; a requirement that is
 * both satisfied and violated counts as not satisfied.
 */
public final class RubricScorer {

    private RubricScorer() {}

    public static double totalWeight(List<AuditorInstructions.Requirement> requirements) {
        if (requirements == null) return 0;
        return requirements.stream().mapToDouble(AuditorInstructions.Requirement::weight).sum();
    }

    /** An auditor without requirements has no assessment objectives, which is not the same as scoring zero. */
    public static boolean hasAssessmentObjectives(AuditorInstructions instructions) {
        return instructions != null && instructions.requirements() != null && !instructions.requirements().isEmpty();
    }

    public static RubricResult aggregate(AuditorInstructions instructions, List<RequirementOutcome> outcomes) {
        double passingScore = instructions != null ? instructions.passingScore() : 0;
        List<RequirementOutcome> safe = outcomes != null ? List.copyOf(outcomes) : List.of();
        double total = 0;
        double satisfied = 0;
        for (RequirementOutcome outcome : safe) {
            if (!outcome.evaluated()) continue;
            total += outcome.weight();
            if (outcome.passed()) satisfied += outcome.weight();
        }
        double score = total > 0 ? satisfied / total * 100.0 : 0;
        boolean passed = total > 0 && score >= passingScore;
        return new RubricResult(score, passed, total, satisfied, passingScore, safe);
    }

    /** One decimal, truncated toward zero: 79.95 is shown as {@code 79.9/100}. */
    public static String formatScore(double score) {
        return BigDecimal.valueOf(score).setScale(1, RoundingMode.DOWN).toPlainString() + "/100";
    }
}
