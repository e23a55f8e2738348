package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.RequirementOutcome;
import io.github.drompincen.complianceboard.protocol.api.RubricResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RubricScorerTest {

    @Test
    void scoreIsSatisfiedOverEvaluatedWeight() {
        RubricResult result = RubricScorer.aggregate(AuditorFixtures.sixtyForty(), List.of(
                outcome("r1", true, true, false, 60),
                outcome("r2", true, false, false, 40)));

        assertThat(result.score()).isCloseTo(60.0, within(1e-9));
        assertThat(result.totalWeight()).isEqualTo(100);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void unevaluatedRequirementsAreLeftOutOfTheTotal() {
        RubricResult result = RubricScorer.aggregate(AuditorFixtures.sixtyForty(), List.of(
                outcome("r1", true, true, false, 60),
                outcome("r2", false, false, false, 40)));

        assertThat(result.totalWeight()).isEqualTo(60);
        assertThat(result.score()).isEqualTo(100.0);
        assertThat(result.passed()).isTrue();
    }

    @Test
    void satisfiedButViolatedDoesNotCount() {
        RubricResult result = RubricScorer.aggregate(AuditorFixtures.sixtyForty(), List.of(
                outcome("r1", true, true, true, 60),
                outcome("r2", true, true, false, 40)));

        assertThat(result.satisfiedWeight()).isEqualTo(40);
    }

    @Test
    void noOutcomesScoreZeroAndFail() {
        RubricResult result = RubricScorer.aggregate(AuditorFixtures.sixtyForty(), List.of());

        assertThat(result.score()).isZero();
        assertThat(result.passed()).isFalse();
    }

    @Test
    void scoreIsTruncatedToOneDecimal() {
        assertThat(RubricScorer.formatScore(79.95)).isEqualTo("79.9/100");
        assertThat(RubricScorer.formatScore(80)).isEqualTo("80.0/100");
        assertThat(RubricScorer.formatScore(66.66666)).isEqualTo("66.6/100");
        assertThat(RubricScorer.formatScore(100)).isEqualTo("100.0/100");
    }

    @Test
    void reportStatusTriState() {
        assertThat(AuditReportStatus.of("passed")).isEqualTo(AuditReportStatus.PASSED);
        assertThat(AuditReportStatus.of("FAILED")).isEqualTo(AuditReportStatus.FAILED);
        assertThat(AuditReportStatus.of("running")).isEqualTo(AuditReportStatus.RUNNING);
        assertThat(AuditReportStatus.of("error")).isEqualTo(AuditReportStatus.OTHER);
        assertThat(AuditReportStatus.of(null)).isEqualTo(AuditReportStatus.OTHER);
        assertThat(AuditReportStatus.RUNNING.isTerminal()).isFalse();
    }

    private static RequirementOutcome outcome(String id, boolean evaluated, boolean satisfied, boolean violated,
                                              double weight) {
        return new RequirementOutcome(id, id, evaluated, satisfied, violated, weight, null, List.of());
    }
}
