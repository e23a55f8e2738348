package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.client.api.ApiCalls;
import io.github.drompincen.complianceboard.client.api.ComplianceApi;
import io.github.drompincen.complianceboard.client.state.*;
import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.runtime.auditor.AuditorValidator;
import io.github.drompincen.complianceboard.runtime.auditor.RubricScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Paged auditor list of one project with create, update, delete and run. Payloads are validated before any
 * call; a running auditor only disables its own run control.
 */
public class AuditorBoard {

    private static final Logger log = LoggerFactory.getLogger(AuditorBoard.class);

    private final ComplianceApi api;
    private final String projectId;
    private final Notifier notifier;
    private final Executor ui;
    private final int pageSize;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final StaleResponseGuard reportsGuard = new StaleResponseGuard();

    private LoadState<PageResult<AuditorDto>> page = LoadState.idle();
    private int offset;
    private String reportsAuditorId;
    private LoadState<PageResult<AuditReportDto>> reports = LoadState.idle();

    public AuditorBoard(ComplianceApi api, String projectId, Notifier notifier, Executor ui, int pageSize) {
        this.api = api;
        this.projectId = projectId;
        this.notifier = notifier;
        this.ui = ui;
        this.pageSize = pageSize;
    }

    public static String runKey(String auditorId) {
        return InFlightTracker.key("auditor", "run", auditorId);
    }

    // ---- Listing ----

    public CompletableFuture<Void> load(int newOffset) {
        int requested = Math.max(0, newOffset);
        offset = requested;
        page = LoadState.loading(page.value());
        return api.listAuditors(projectId, pageSize, requested).handleAsync((result, error) -> {
            if (error != null) {
                page = LoadState.error(ApiCalls.message(error, "load auditors"), () -> load(requested));
            } else {
                page = LoadState.loaded(result);
            }
            return null;
        }, ui);
    }

    public CompletableFuture<Void> refresh() {
        return load(offset);
    }

    public Disposable bind(RefreshTrigger trigger) {
        return trigger.versions().subscribe(version -> ui.execute(this::refresh));
    }

    public boolean hasNextPage() {
        PageResult<AuditorDto> current = page.value();
        return current != null && offset + pageSize < current.total();
    }

    public CompletableFuture<Void> nextPage() {
        return hasNextPage() ? load(offset + pageSize) : CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<Void> previousPage() {
        return offset > 0 ? load(offset - pageSize) : CompletableFuture.completedFuture(null);
    }

    // ---- Mutations ----

    public CompletableFuture<ApiResult<AuditorDto>> create(AuditorRequest request) {
        ApiResult<AuditorRequest> checked = AuditorValidator.validateCreate(request);
        if (!checked.success()) return rejected(checked.error());
        return ApiCalls.guard(() -> api.createAuditor(projectId, checked.value()), "create auditor")
                .thenApplyAsync(result -> afterSave(result, "Auditor created"), ui);
    }

    public CompletableFuture<ApiResult<AuditorDto>> update(String auditorId, AuditorRequest request) {
        ApiResult<AuditorRequest> checked = AuditorValidator.validateUpdate(request);
        if (!checked.success()) return rejected(checked.error());
        return ApiCalls.guard(() -> api.updateAuditor(projectId, auditorId, checked.value()), "update auditor")
                .thenApplyAsync(result -> afterSave(result, "Auditor updated"), ui);
    }

    /** Drops the auditor from the current page at once; puts the page back when the server refuses. */
    public CompletableFuture<ApiResult<Void>> delete(String auditorId) {
        OptimisticMutation<LoadState<PageResult<AuditorDto>>> mutation = new OptimisticMutation<>(
                () -> page, previous -> page = previous, () -> {
                    if (page.value() != null) page = LoadState.loaded(without(page.value(), auditorId));
                });
        return mutation.execute(() -> api.deleteAuditor(projectId, auditorId), ui, "delete auditor")
                .thenApply(result -> {
                    if (result.success()) notifier.success("Auditor deleted");
                    else notifier.error(result.error());
                    return result;
                });
    }

    /**
     * Starts a run. While it is being started the auditor's run control is busy; a second run of the same
     * auditor is refused without a call.
     */
    public CompletableFuture<ApiResult<AuditReportDto>> run(String auditorId) {
        String key = runKey(auditorId);
        if (!inFlight.begin(key)) return CompletableFuture.completedFuture(ApiResult.failure("Auditor is already running"));
        return ApiCalls.guard(() -> api.runAuditor(projectId, auditorId), "run auditor")
                .thenApplyAsync(result -> {
                    inFlight.end(key);
                    if (result.success()) {
                        log.info("Audit run started for auditor {}", auditorId);
                        notifier.success("Audit started");
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                }, ui);
    }

    public boolean isRunning(String auditorId) {
        return inFlight.isBusy(runKey(auditorId));
    }

    // ---- Reports ----

    /** Shows one auditor's reports; a response for a previously opened auditor is ignored. */
    public CompletableFuture<Void> openReports(String auditorId, int reportOffset) {
        long token = reportsGuard.next();
        reportsAuditorId = auditorId;
        reports = LoadState.loading(null);
        return api.listAuditReports(projectId, auditorId, pageSize, Math.max(0, reportOffset))
                .handleAsync((result, error) -> {
                    if (!reportsGuard.isCurrent(token)) return null;
                    reports = error != null
                            ? LoadState.error(ApiCalls.message(error, "load reports"),
                                    () -> openReports(auditorId, reportOffset))
                            : LoadState.loaded(result);
                    return null;
                }, ui);
    }

    public void closeReports() {
        reportsGuard.invalidate();
        reportsAuditorId = null;
        reports = LoadState.idle();
    }

    public static String displayScore(AuditReportDto report) {
        return RubricScorer.formatScore(report.score());
    }

    /** An auditor without requirements has no assessment objectives, which is not the same as a zero score. */
    public static boolean hasAssessmentObjectives(AuditorDto auditor) {
        return RubricScorer.hasAssessmentObjectives(auditor.instructions());
    }

    // ---- Views ----

    public LoadState<PageResult<AuditorDto>> page() {
        return page;
    }

    public int offset() {
        return offset;
    }

    public String reportsAuditorId() {
        return reportsAuditorId;
    }

    public LoadState<PageResult<AuditReportDto>> reports() {
        return reports;
    }

    // ---- Internals ----

    private <T> CompletableFuture<ApiResult<T>> rejected(String error) {
        log.debug("Auditor payload rejected: {}", error);
        notifier.error(error);
        return CompletableFuture.completedFuture(ApiResult.failure(error));
    }

    private ApiResult<AuditorDto> afterSave(ApiResult<AuditorDto> result, String message) {
        if (result.success()) {
            notifier.success(message);
            refresh();
        } else {
            notifier.error(result.error());
        }
        return result;
    }

    private static PageResult<AuditorDto> without(PageResult<AuditorDto> current, String auditorId) {
        List<AuditorDto> kept = current.items().stream().filter(a -> !auditorId.equals(a.id())).toList();
        long removed = current.items().size() - kept.size();
        return PageResult.of(kept, current.total() - removed, current.limit(), current.offset());
    }
}
