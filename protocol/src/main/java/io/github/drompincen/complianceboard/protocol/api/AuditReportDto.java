package io.github.drompincen.complianceboard.protocol.api;

import java.time.Instant;
import java.util.List;

public record AuditReportDto(
        String id,
        String auditorId,
        String status,
        double score,
        Instant executedAt,
        String executedBy,
        long duration,
        List<RequirementOutcome> results,
        String summary,
        String errorMessage
) {
    public static final String STATUS_PASSED = "passed";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_ERROR = "error";

    public enum Trigger {
        MANUAL, SCHEDULED, ASSISTANT;

        public String wireValue() {
            return name().toLowerCase();
        }
    }
}
