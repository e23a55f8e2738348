package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.AuditorDto;
import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.RequirementOutcome;

import java.util.List;

/**
 * Decides, per requirement, whether the gathered evidence satisfies its success criteria and whether it
 * trips a failure criterion. Aggregation into a score is left to {@link RubricScorer}.
 */
public interface RequirementEvaluator {

    List<RequirementOutcome> evaluate(Context context);

    /**
     * @param document the page a document-scoped auditor is attached to, null for project-wide auditors
     */
    record Context(AuditorDto auditor, DocumentPageDto document, List<EvidenceDto> evidence) {}
}
