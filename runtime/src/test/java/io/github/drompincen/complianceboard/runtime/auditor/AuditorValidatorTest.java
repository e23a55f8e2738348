package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.AuditorInstructions;
import io.github.drompincen.complianceboard.protocol.api.AuditorRequest;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditorValidatorTest {

    @Test
    void sixtyFortyAuditorIsValid() {
        ApiResult<AuditorRequest> result = AuditorValidator.validateCreate(
                AuditorFixtures.request("Access auditor", "manual", AuditorFixtures.sixtyForty()));

        assertThat(result.success()).isTrue();
        assertThat(result.value().instructions().requirements()).hasSize(2);
        assertThat(RubricScorer.totalWeight(result.value().instructions().requirements())).isEqualTo(100);
    }

    @Test
    void blankNameIsRejected() {
        ApiResult<AuditorRequest> result = AuditorValidator.validateCreate(
                AuditorFixtures.request("  ", null, AuditorFixtures.sixtyForty()));

        assertThat(result.error()).isEqualTo("Name is required");
    }

    @Test
    void whitespaceOnlyCriteriaAreStrippedAndThenRejected() {
        AuditorInstructions instructions = new AuditorInstructions(80, List.of(
                new AuditorInstructions.Requirement("r1", "Encryption", null, null,
                        Arrays.asList("   ", "", null), List.of("plaintext"), 100)), null);

        ApiResult<AuditorRequest> result = AuditorValidator.validateCreate(
                AuditorFixtures.request("Crypto", null, instructions));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Requirement \"Encryption\" needs at least one success criterion");
    }

    @Test
    void missingFailureCriterionNamesRequirement() {
        AuditorInstructions instructions = new AuditorInstructions(80, List.of(
                AuditorFixtures.requirement("r1", "MFA", 50),
                new AuditorInstructions.Requirement("r2", "Logging", null, null,
                        List.of("logs retained"), List.of(" "), 50)), null);

        ApiResult<AuditorRequest> result = AuditorValidator.validateCreate(
                AuditorFixtures.request("Ops", null, instructions));

        assertThat(result.error()).isEqualTo("Requirement \"Logging\" needs at least one failure criterion");
    }

    @Test
    void untitledRequirementIsNamedByPosition() {
        AuditorInstructions instructions = new AuditorInstructions(80, List.of(
                AuditorFixtures.requirement("r1", "MFA", 50),
                new AuditorInstructions.Requirement("r2", " ", null, null,
                        List.of("a"), List.of("b"), 50)), null);

        assertThat(AuditorValidator.validateCreate(AuditorFixtures.request("Ops", null, instructions)).error())
                .isEqualTo("Requirement #2 needs a title");
    }

    @Test
    void criteriaAreTrimmedAndIdsFilled() {
        AuditorInstructions instructions = new AuditorInstructions(70, List.of(
                new AuditorInstructions.Requirement(null, " Backups ", null, null,
                        List.of(" nightly backup ", " "), List.of("no backup"), 100)), null);

        AuditorInstructions cleaned = AuditorValidator.validateCreate(
                AuditorFixtures.request("Backups", null, instructions)).value().instructions();

        AuditorInstructions.Requirement req = cleaned.requirements().get(0);
        assertThat(req.id()).isEqualTo("req-1");
        assertThat(req.title()).isEqualTo("Backups");
        assertThat(req.successCriteria()).containsExactly("nightly backup");
    }

    @Test
    void passingScoreAndWeightMustBeWithinRange() {
        AuditorInstructions badPassing = new AuditorInstructions(120, List.of(), null);
        AuditorInstructions badWeight = new AuditorInstructions(80, List.of(
                AuditorFixtures.requirement("r1", "MFA", 150)), null);

        assertThat(AuditorValidator.validateCreate(AuditorFixtures.request("a", null, badPassing)).error())
                .isEqualTo("Passing score must be between 0 and 100");
        assertThat(AuditorValidator.validateCreate(AuditorFixtures.request("a", null, badWeight)).error())
                .isEqualTo("Requirement \"MFA\" weight must be between 0 and 100");
    }

    @Test
    void scheduleMustBeManualOrFiveFieldCron() {
        assertThat(AuditorValidator.validateCreate(
                AuditorFixtures.request("a", "0 0 * *", AuditorFixtures.sixtyForty())).success()).isFalse();
        assertThat(AuditorValidator.validateCreate(
                AuditorFixtures.request("a", "0  0 1 */3 *", AuditorFixtures.sixtyForty())).value().schedule())
                .isEqualTo("0 0 1 */3 *");
        assertThat(AuditorValidator.validateCreate(
                AuditorFixtures.request("a", "", AuditorFixtures.sixtyForty())).value().schedule())
                .isEqualTo("manual");
    }

    @Test
    void createNeedsInstructionsButUpdateDoesNot() {
        assertThat(AuditorValidator.validateCreate(AuditorFixtures.request("a", null, null)).error())
                .isEqualTo("Instructions are required");
        assertThat(AuditorValidator.validateUpdate(new AuditorRequest(null, "new desc", null, false, null, null))
                .success()).isTrue();
    }

    @Test
    void emptyRequirementListIsStructurallyValid() {
        ApiResult<AuditorRequest> result = AuditorValidator.validateCreate(
                AuditorFixtures.request("Draft", null, new AuditorInstructions(80, List.of(), null)));

        assertThat(result.success()).isTrue();
        assertThat(RubricScorer.hasAssessmentObjectives(result.value().instructions())).isFalse();
    }
}
