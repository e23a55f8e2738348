package io.github.drompincen.complianceboard.protocol.api;

import java.util.List;

public record RubricResult(
        double score,
        boolean passed,
        double totalWeight,
        double satisfiedWeight,
        double passingScore,
        List<RequirementOutcome> outcomes
) {}
