package io.github.drompincen.complianceboard.protocol.api;

import java.util.List;

public record AuditorInstructions(
        double passingScore,
        List<Requirement> requirements,
        String evaluationInstructions
) {
    public record Requirement(
            String id,
            String title,
            String description,
            String context,
            List<String> successCriteria,
            List<String> failureCriteria,
            double weight
    ) {}
}
