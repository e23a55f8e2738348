package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Triggers audit runs. A run is recorded as a {@code running} report straight away and evaluated in the
 * background; the caller never waits for the verdict.
 */
@Service
public class AuditRunService {

    private static final Logger log = LoggerFactory.getLogger(AuditRunService.class);

    private final AuditorService auditorService;
    private final DocumentService documentService;
    private final EvidenceService evidenceService;
    private final RequirementEvaluator evaluator;
    private final ProjectEventPublisher events;
    private final Executor executor;

    @Autowired
    public AuditRunService(AuditorService auditorService, DocumentService documentService,
                           EvidenceService evidenceService, RequirementEvaluator evaluator,
                           ProjectEventPublisher events) {
        this(auditorService, documentService, evidenceService, evaluator, events,
                Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "audit-run");
                    t.setDaemon(true);
                    return t;
                }));
    }

    public AuditRunService(AuditorService auditorService, DocumentService documentService,
                           EvidenceService evidenceService, RequirementEvaluator evaluator,
                           ProjectEventPublisher events, Executor executor) {
        this.auditorService = auditorService;
        this.documentService = documentService;
        this.evidenceService = evidenceService;
        this.evaluator = evaluator;
        this.events = events;
        this.executor = executor;
    }

    public ApiResult<AuditReportDto> run(String projectId, String auditorId, AuditReportDto.Trigger trigger) {
        Optional<AuditorDto> found = auditorService.get(projectId, auditorId);
        if (found.isEmpty()) return ApiResult.failure(AuditorService.NOT_FOUND);
        AuditorDto auditor = found.get();
        if (!auditor.isActive()) return ApiResult.failure("Auditor is not active");
        if (!RubricScorer.hasAssessmentObjectives(auditor.instructions())) {
            return ApiResult.failure("Auditor has no requirements to evaluate");
        }

        ApiResult<AuditReportDto> started = auditorService.startRun(projectId, auditorId, trigger);
        if (!started.success()) return started;
        AuditReportDto report = started.value();
        log.info("Audit run {} started for auditor {} ({})", report.id(), auditorId, trigger.wireValue());
        events.emit(projectId, ChangeEvent.EntityType.AUDIT_REPORT, report.id(),
                ChangeEvent.Action.RUN_STARTED, origin(trigger));

        executor.execute(() -> execute(projectId, auditor, report, trigger));
        return ApiResult.success(report);
    }

    /** Lets an external executor post its per-requirement verdicts for a running report. */
    public ApiResult<AuditReportDto> completeRun(String projectId, String reportId, List<RequirementOutcome> outcomes) {
        Optional<AuditReportDto> found = auditorService.findProjectReport(projectId, reportId);
        if (found.isEmpty()) return ApiResult.failure("Report not found");
        AuditReportDto report = found.get();
        if (!AuditReportDto.STATUS_RUNNING.equals(report.status())) {
            return ApiResult.failure("Report is not running");
        }
        Optional<AuditorDto> auditor = auditorService.get(projectId, report.auditorId());
        if (auditor.isEmpty()) return ApiResult.failure(AuditorService.NOT_FOUND);

        AuditReportDto finished = finish(report, auditor.get().instructions(),
                align(auditor.get().instructions(), outcomes));
        auditorService.finishRun(projectId, finished);
        events.emit(projectId, ChangeEvent.EntityType.AUDIT_REPORT, finished.id(),
                ChangeEvent.Action.RUN_COMPLETED, ChangeEvent.Origin.USER);
        return ApiResult.success(finished);
    }

    private void execute(String projectId, AuditorDto auditor, AuditReportDto report, AuditReportDto.Trigger trigger) {
        AuditReportDto finished;
        try {
            DocumentPageDto document = auditor.documentId() != null
                    ? documentService.find(projectId, auditor.documentId()).orElse(null)
                    : null;
            List<EvidenceDto> evidence = auditor.documentId() != null
                    ? evidenceService.evidenceFor(projectId, auditor.documentId())
                    : evidenceService.evidenceForProject(projectId);
            List<RequirementOutcome> outcomes = evaluator.evaluate(
                    new RequirementEvaluator.Context(auditor, document, evidence));
            finished = finish(report, auditor.instructions(), align(auditor.instructions(), outcomes));
            log.info("Audit run {} for auditor {} finished: {} ({})", report.id(), auditor.id(),
                    finished.status(), RubricScorer.formatScore(finished.score()));
        } catch (Exception e) {
            log.error("Audit run {} for auditor {} failed", report.id(), auditor.id(), e);
            finished = new AuditReportDto(report.id(), report.auditorId(), AuditReportDto.STATUS_ERROR, 0,
                    report.executedAt(), report.executedBy(), elapsedSeconds(report.executedAt()), List.of(),
                    null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        auditorService.finishRun(projectId, finished);
        events.emit(projectId, ChangeEvent.EntityType.AUDIT_REPORT, finished.id(),
                ChangeEvent.Action.RUN_COMPLETED, origin(trigger));
    }

    private AuditReportDto finish(AuditReportDto report, AuditorInstructions instructions,
                                  List<RequirementOutcome> outcomes) {
        RubricResult result = RubricScorer.aggregate(instructions, outcomes);
        long met = result.outcomes().stream().filter(RequirementOutcome::passed).count();
        long evaluated = result.outcomes().stream().filter(RequirementOutcome::evaluated).count();
        String summary = String.format("%d of %d requirements met, score %s (passing %s)", met, evaluated,
                RubricScorer.formatScore(result.score()), RubricScorer.formatScore(result.passingScore()));
        return new AuditReportDto(report.id(), report.auditorId(),
                result.passed() ? AuditReportDto.STATUS_PASSED : AuditReportDto.STATUS_FAILED,
                result.score(), report.executedAt(), report.executedBy(), elapsedSeconds(report.executedAt()),
                result.outcomes(), summary, null);
    }

    // Outcomes for known requirements always carry the requirement's own title and weight.
    private static List<RequirementOutcome> align(AuditorInstructions instructions, List<RequirementOutcome> outcomes) {
        if (outcomes == null) return List.of();
        Map<String, AuditorInstructions.Requirement> byId = new HashMap<>();
        if (instructions != null && instructions.requirements() != null) {
            instructions.requirements().forEach(r -> byId.put(r.id(), r));
        }
        List<RequirementOutcome> aligned = new ArrayList<>(outcomes.size());
        for (RequirementOutcome o : outcomes) {
            AuditorInstructions.Requirement req = o.requirementId() != null ? byId.get(o.requirementId()) : null;
            if (req == null) {
                aligned.add(o);
            } else {
                aligned.add(new RequirementOutcome(o.requirementId(), req.title(), o.evaluated(), o.satisfied(),
                        o.violated(), req.weight(), o.findings(),
                        o.evidenceReviewed() != null ? o.evidenceReviewed() : List.of()));
            }
        }
        return aligned;
    }

    private long elapsedSeconds(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, auditorService.now()).getSeconds());
    }

    private static ChangeEvent.Origin origin(AuditReportDto.Trigger trigger) {
        return switch (trigger) {
            case MANUAL -> ChangeEvent.Origin.USER;
            case SCHEDULED -> ChangeEvent.Origin.SCHEDULER;
            case ASSISTANT -> ChangeEvent.Origin.ASSISTANT;
        };
    }
}
