package io.github.drompincen.complianceboard.runtime.related;

import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;
import io.github.drompincen.complianceboard.protocol.api.RelatedPageSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits related pages into controls, risks, threats and everything else. A page lands in exactly one group:
 * the control flag or kind wins over risk, risk over threat. Input order is kept within a group.
 */
public final class RelatedPageClassifier {

    private RelatedPageClassifier() {}

    public static RelatedPageSummary.Groups partition(List<RelatedPageSummary> relatedPages) {
        List<RelatedPageSummary> controls = new ArrayList<>();
        List<RelatedPageSummary> risks = new ArrayList<>();
        List<RelatedPageSummary> threats = new ArrayList<>();
        List<RelatedPageSummary> others = new ArrayList<>();
        if (relatedPages != null) {
            for (RelatedPageSummary page : relatedPages) {
                if (isControl(page)) {
                    controls.add(page);
                } else if (DocumentPageDto.KIND_RISK.equals(page.pageKind())) {
                    risks.add(page);
                } else if (DocumentPageDto.KIND_THREAT.equals(page.pageKind())) {
                    threats.add(page);
                } else {
                    others.add(page);
                }
            }
        }
        return new RelatedPageSummary.Groups(List.copyOf(controls), List.copyOf(risks),
                List.copyOf(threats), List.copyOf(others));
    }

    public static boolean isControl(RelatedPageSummary page) {
        return Boolean.TRUE.equals(page.isControl()) || DocumentPageDto.KIND_CONTROL.equals(page.pageKind());
    }
}
