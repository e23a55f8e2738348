package io.github.drompincen.complianceboard.runtime.evidence;

import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceEntry;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;

import java.util.ArrayList;
import java.util.List;

public final class EvidenceTimeline {

    private EvidenceTimeline() {}

    /** All requests first, then all evidence items, each group in input order. */
    public static List<EvidenceEntry> combine(List<EvidenceDto> evidence, List<EvidenceRequestDto> requests) {
        int size = (evidence != null ? evidence.size() : 0) + (requests != null ? requests.size() : 0);
        List<EvidenceEntry> entries = new ArrayList<>(size);
        if (requests != null) {
            for (EvidenceRequestDto request : requests) entries.add(EvidenceEntry.of(request));
        }
        if (evidence != null) {
            for (EvidenceDto item : evidence) entries.add(EvidenceEntry.of(item));
        }
        return List.copyOf(entries);
    }
}
