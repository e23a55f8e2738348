package io.github.drompincen.complianceboard.runtime.evidence;

import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto.Bucket;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceRequestClassifierTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Test
    void statusIsMatchedBySubstring() {
        assertThat(EvidenceRequestClassifier.bucket("Completed")).isEqualTo(Bucket.COMPLETED);
        assertThat(EvidenceRequestClassifier.bucket("resolved")).isEqualTo(Bucket.COMPLETED);
        assertThat(EvidenceRequestClassifier.bucket("OVERDUE")).isEqualTo(Bucket.OVERDUE);
        assertThat(EvidenceRequestClassifier.bucket("late")).isEqualTo(Bucket.OVERDUE);
        assertThat(EvidenceRequestClassifier.bucket("open")).isEqualTo(Bucket.IN_PROGRESS);
        assertThat(EvidenceRequestClassifier.bucket("in-progress")).isEqualTo(Bucket.IN_PROGRESS);
        assertThat(EvidenceRequestClassifier.bucket("in_progress")).isEqualTo(Bucket.IN_PROGRESS);
        assertThat(EvidenceRequestClassifier.bucket("pending")).isEqualTo(Bucket.OTHER);
        assertThat(EvidenceRequestClassifier.bucket(null)).isEqualTo(Bucket.OTHER);
    }

    @Test
    void incompleteIsNotCompleted() {
        assertThat(EvidenceRequestClassifier.bucket("incomplete")).isEqualTo(Bucket.OTHER);
        assertThat(EvidenceRequestClassifier.bucket("Incomplete - awaiting upload")).isEqualTo(Bucket.OTHER);
        assertThat(EvidenceRequestClassifier.isOpen(new EvidenceRequestDto("r1", "d1", "MFA export", null,
                "Incomplete", null, null))).isTrue();
        assertThat(EvidenceRequestClassifier.bucket("fulfilled")).isEqualTo(Bucket.OTHER);
    }

    @Test
    void pastDueOpenRequestIsOverdue() {
        assertThat(EvidenceRequestClassifier.bucket("pending", TODAY.minusDays(1), TODAY)).isEqualTo(Bucket.OVERDUE);
        assertThat(EvidenceRequestClassifier.bucket("in progress", TODAY.minusDays(1), TODAY)).isEqualTo(Bucket.OVERDUE);
        assertThat(EvidenceRequestClassifier.bucket("pending", TODAY, TODAY)).isEqualTo(Bucket.OTHER);
    }

    @Test
    void completedRequestIsNeverOverdue() {
        assertThat(EvidenceRequestClassifier.bucket("completed", TODAY.minusDays(30), TODAY))
                .isEqualTo(Bucket.COMPLETED);
    }
}
