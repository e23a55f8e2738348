package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.MutableClock;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuditRunServiceTest {

    private static final String PROJECT = "proj";

    private MutableClock clock;
    private ProjectEventPublisher events;
    private AuditorService auditorService;
    private DocumentService documentService;
    private EvidenceService evidenceService;
    private final List<Runnable> deferred = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-04T10:15:00Z");
        events = new ProjectEventPublisher(clock);
        ComplianceBoardProperties properties = ComplianceBoardProperties.defaults();
        AtomicInteger ids = new AtomicInteger();
        evidenceService = new EvidenceService(events, clock);
        documentService = new DocumentService(evidenceService, events, properties, clock,
                () -> "doc-" + ids.incrementAndGet());
        auditorService = new AuditorService(events, properties, clock);
    }

    @Test
    void runIsRecordedAsRunningThenPasses() {
        String docId = documentService.createRoot(PROJECT, "Access control", ChangeEvent.Origin.USER).id();
        evidenceService.addEvidence(PROJECT, docId, new EvidenceDto(null, null, "IdP export",
                "MFA is enforced for all admins", null, null, null, null));
        AuditorDto auditor = scopedAuditor(docId);

        ApiResult<AuditReportDto> started = sameThread().run(PROJECT, auditor.id(), AuditReportDto.Trigger.MANUAL);

        assertThat(started.success()).isTrue();
        assertThat(started.value().status()).isEqualTo(AuditReportDto.STATUS_RUNNING);
        assertThat(started.value().executedBy()).isEqualTo("manual");

        AuditReportDto latest = auditorService.reports(PROJECT, auditor.id(), 10, 0).items().get(0);
        assertThat(latest.id()).isEqualTo(started.value().id());
        assertThat(latest.status()).isEqualTo(AuditReportDto.STATUS_PASSED);
        assertThat(latest.score()).isEqualTo(100.0);
        assertThat(latest.summary()).isEqualTo("2 of 2 requirements met, score 100.0/100 (passing 80.0/100)");

        AuditorDto after = auditorService.get(PROJECT, auditor.id()).orElseThrow();
        assertThat(after.runCount()).isEqualTo(1);
        assertThat(after.lastRunAt()).isEqualTo(clock.instant());
        assertThat(after.lastStatus()).isEqualTo(AuditReportDto.STATUS_PASSED);
    }

    @Test
    void runWithoutEvidenceFails() {
        String docId = documentService.createRoot(PROJECT, "Access control", ChangeEvent.Origin.USER).id();
        AuditorDto auditor = scopedAuditor(docId);

        sameThread().run(PROJECT, auditor.id(), AuditReportDto.Trigger.MANUAL);

        AuditReportDto latest = auditorService.reports(PROJECT, auditor.id(), 10, 0).items().get(0);
        assertThat(latest.status()).isEqualTo(AuditReportDto.STATUS_FAILED);
        assertThat(latest.score()).isZero();
        assertThat(latest.results()).extracting(RequirementOutcome::findings).containsOnly("No evidence attached");
    }

    @Test
    void evaluatorErrorMarksReportAsError() {
        RequirementEvaluator broken = mock(RequirementEvaluator.class);
        when(broken.evaluate(any())).thenThrow(new IllegalStateException("model unavailable"));
        AuditRunService runs = new AuditRunService(auditorService, documentService, evidenceService, broken,
                events, Runnable::run);
        AuditorDto auditor = auditorService.create(PROJECT,
                AuditorFixtures.request("Access", null, AuditorFixtures.sixtyForty())).value();

        runs.run(PROJECT, auditor.id(), AuditReportDto.Trigger.ASSISTANT);

        AuditReportDto latest = auditorService.reports(PROJECT, auditor.id(), 10, 0).items().get(0);
        assertThat(latest.status()).isEqualTo(AuditReportDto.STATUS_ERROR);
        assertThat(latest.errorMessage()).isEqualTo("model unavailable");
        assertThat(auditorService.get(PROJECT, auditor.id()).orElseThrow().lastStatus())
                .isEqualTo(AuditReportDto.STATUS_ERROR);
    }

    @Test
    void inactiveOrUnknownAuditorsAreRejected() {
        AuditorDto paused = auditorService.create(PROJECT, new AuditorRequest("Paused", null, null, false, null,
                AuditorFixtures.sixtyForty())).value();
        AuditRunService runs = sameThread();

        assertThat(runs.run(PROJECT, paused.id(), AuditReportDto.Trigger.MANUAL).error())
                .isEqualTo("Auditor is not active");
        assertThat(runs.run(PROJECT, "ghost", AuditReportDto.Trigger.MANUAL).error())
                .isEqualTo(AuditorService.NOT_FOUND);
        assertThat(auditorService.get(PROJECT, paused.id()).orElseThrow().runCount()).isZero();
    }

    @Test
    void auditorWithoutRequirementsIsRejected() {
        AuditorDto empty = auditorService.create(PROJECT, AuditorFixtures.request("Empty", null,
                new AuditorInstructions(80, List.of(), null))).value();

        assertThat(sameThread().run(PROJECT, empty.id(), AuditReportDto.Trigger.MANUAL).error())
                .isEqualTo("Auditor has no requirements to evaluate");
    }

    @Test
    void secondRunWhileRunningIsRejected() {
        AuditorDto auditor = auditorService.create(PROJECT,
                AuditorFixtures.request("Access", null, AuditorFixtures.sixtyForty())).value();
        AuditRunService runs = deferredRuns();

        assertThat(runs.run(PROJECT, auditor.id(), AuditReportDto.Trigger.MANUAL).success()).isTrue();
        assertThat(runs.run(PROJECT, auditor.id(), AuditReportDto.Trigger.MANUAL).error())
                .isEqualTo(AuditorService.ALREADY_RUNNING);
        assertThat(deferred).hasSize(1);
    }

    @Test
    void concurrentStartsYieldOneRunningReport() throws Exception {
        AuditorDto auditor = auditorService.create(PROJECT,
                AuditorFixtures.request("Access", null, AuditorFixtures.sixtyForty())).value();
        List<Runnable> queued = new CopyOnWriteArrayList<>();
        AuditRunService runs = runService(queued::add);
        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ApiResult<AuditReportDto>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    barrier.await(5, TimeUnit.SECONDS);
                    return runs.run(PROJECT, auditor.id(), AuditReportDto.Trigger.MANUAL);
                }));
            }
            List<ApiResult<AuditReportDto>> results = new ArrayList<>();
            for (Future<ApiResult<AuditReportDto>> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(r -> r.success()).hasSize(1);
            assertThat(results).filteredOn(r -> !r.success())
                    .extracting(ApiResult::error).containsOnly(AuditorService.ALREADY_RUNNING);
        } finally {
            pool.shutdownNow();
        }

        assertThat(queued).hasSize(1);
        assertThat(auditorService.reports(PROJECT, auditor.id(), 10, 0).items())
                .extracting(AuditReportDto::status).containsExactly(AuditReportDto.STATUS_RUNNING);
        assertThat(auditorService.get(PROJECT, auditor.id()).orElseThrow().runCount()).isEqualTo(1);
    }

    @Test
    void externalVerdictsCompleteARunningReport() {
        AuditorDto auditor = auditorService.create(PROJECT,
                AuditorFixtures.request("Access", null, AuditorFixtures.sixtyForty())).value();
        AuditRunService runs = deferredRuns();
        AuditReportDto running = runs.run(PROJECT, auditor.id(), AuditReportDto.Trigger.ASSISTANT).value();

        ApiResult<AuditReportDto> done = runs.completeRun(PROJECT, running.id(), List.of(
                new RequirementOutcome("r1", "ignored", true, true, false, 5, "ok", List.of("IdP export")),
                new RequirementOutcome("r2", "ignored", true, false, false, 5, "missing", null)));

        assertThat(done.success()).isTrue();
        assertThat(done.value().status()).isEqualTo(AuditReportDto.STATUS_FAILED);
        assertThat(done.value().score()).isEqualTo(60.0);
        assertThat(done.value().results()).extracting(RequirementOutcome::title).containsExactly("MFA", "Access reviews");
        assertThat(runs.completeRun(PROJECT, running.id(), List.of()).error()).isEqualTo("Report is not running");
        assertThat(runs.completeRun(PROJECT, "ghost", List.of()).error()).isEqualTo("Report not found");
    }

    private AuditorDto scopedAuditor(String docId) {
        return auditorService.create(PROJECT, new AuditorRequest("Access", null, null, true, docId,
                AuditorFixtures.sixtyForty())).value();
    }

    private AuditRunService sameThread() {
        return runService(Runnable::run);
    }

    private AuditRunService deferredRuns() {
        return runService(deferred::add);
    }

    private AuditRunService runService(Executor executor) {
        return new AuditRunService(auditorService, documentService, evidenceService, new CriteriaMatchEvaluator(),
                events, executor);
    }
}
