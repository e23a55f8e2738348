package io.github.drompincen.complianceboard.runtime.evidence;

import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto.Bucket;

import java.time.LocalDate;
import java.util.Locale;

/** Display bucket of an evidence request, derived from its free-form status and due date. */
public final class EvidenceRequestClassifier {

    private EvidenceRequestClassifier() {}

    public static Bucket bucket(String status) {
        // "in progress" and "in_progress" are read as "in-progress"
        String s = status == null ? "" : status.toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        if (s.contains("completed") || s.contains("resolved")) return Bucket.COMPLETED;
        if (s.contains("overdue") || s.contains("late")) return Bucket.OVERDUE;
        if (s.contains("in-progress") || s.contains("open")) return Bucket.IN_PROGRESS;
        return Bucket.OTHER;
    }

    public static Bucket bucket(String status, LocalDate dueDate, LocalDate today) {
        Bucket bucket = bucket(status);
        if (bucket != Bucket.COMPLETED && dueDate != null && today != null && dueDate.isBefore(today)) {
            return Bucket.OVERDUE;
        }
        return bucket;
    }

    public static Bucket bucket(EvidenceRequestDto request, LocalDate today) {
        return bucket(request.status(), request.dueDate(), today);
    }

    public static boolean isOpen(EvidenceRequestDto request) {
        return bucket(request.status()) != Bucket.COMPLETED;
    }
}
