package io.github.drompincen.complianceboard.runtime.related;

import io.github.drompincen.complianceboard.protocol.api.RelatedPageSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelatedPageClassifierTest {

    @Test
    void controlFlagOrKindWinsOverOtherKinds() {
        RelatedPageSummary flagged = page("1", "risk", true);
        RelatedPageSummary kindControl = page("2", "control", null);
        RelatedPageSummary risk = page("3", "risk", false);
        RelatedPageSummary threat = page("4", "threat", null);
        RelatedPageSummary general = page("5", null, null);

        RelatedPageSummary.Groups groups = RelatedPageClassifier.partition(
                List.of(flagged, kindControl, risk, threat, general));

        assertThat(groups.controls()).containsExactly(flagged, kindControl);
        assertThat(groups.risks()).containsExactly(risk);
        assertThat(groups.threats()).containsExactly(threat);
        assertThat(groups.others()).containsExactly(general);
    }

    @Test
    void inputOrderIsKeptWithinABucket() {
        RelatedPageSummary r1 = page("z", "risk", null);
        RelatedPageSummary r2 = page("a", "risk", null);
        RelatedPageSummary r3 = page("m", "risk", null);

        assertThat(RelatedPageClassifier.partition(List.of(r1, r2, r3)).risks()).containsExactly(r1, r2, r3);
    }

    @Test
    void kindComparisonIsCaseSensitive() {
        RelatedPageSummary upper = page("1", "Risk", null);

        RelatedPageSummary.Groups groups = RelatedPageClassifier.partition(List.of(upper));

        assertThat(groups.others()).containsExactly(upper);
        assertThat(groups.size()).isEqualTo(1);
    }

    @Test
    void nullInputGivesEmptyGroups() {
        assertThat(RelatedPageClassifier.partition(null).size()).isZero();
    }

    private static RelatedPageSummary page(String id, String kind, Boolean isControl) {
        return new RelatedPageSummary(id, "Page " + id, null, kind, isControl, "relates");
    }
}
