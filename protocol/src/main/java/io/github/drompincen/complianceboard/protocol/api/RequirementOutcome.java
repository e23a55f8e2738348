package io.github.drompincen.complianceboard.protocol.api;

import java.util.List;

/**
 * Verdict of an external or built-in executor for one requirement of an auditor.
 * {@code evaluated == false} means the requirement was skipped and does not count toward the total weight.
 */
public record RequirementOutcome(
        String requirementId,
        String title,
        boolean evaluated,
        boolean satisfied,
        boolean violated,
        double weight,
        String findings,
        List<String> evidenceReviewed
) {
    public boolean passed() {
        return evaluated && satisfied && !violated;
    }
}
