package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Auditor definitions and their report history, kept per project.
 */
@Service
public class AuditorService {

    private static final Logger log = LoggerFactory.getLogger(AuditorService.class);

    public static final String NOT_FOUND = "Auditor not found";
    public static final String ALREADY_RUNNING = "Auditor is already running";

    private static final Comparator<AuditorDto> NEWEST_FIRST =
            Comparator.comparing(AuditorDto::createdAt).reversed();
    private static final Comparator<AuditReportDto> LATEST_REPORT_FIRST =
            Comparator.comparing(AuditReportDto::executedAt).reversed();

    private final Map<String, Map<String, AuditorDto>> auditors = new ConcurrentHashMap<>();
    private final Map<String, List<AuditReportDto>> reports = new ConcurrentHashMap<>();
    private final ProjectEventPublisher events;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public AuditorService(ProjectEventPublisher events, ComplianceBoardProperties properties) {
        this(events, properties, Clock.systemUTC());
    }

    public AuditorService(ProjectEventPublisher events, ComplianceBoardProperties properties, Clock clock) {
        this.events = events;
        this.zone = ZoneId.of(properties.auditors().timezone());
        this.clock = clock;
    }

    public ApiResult<AuditorDto> create(String projectId, AuditorRequest request) {
        ApiResult<AuditorRequest> checked = AuditorValidator.validateCreate(request);
        if (!checked.success()) {
            log.debug("Rejected auditor for project {}: {}", projectId, checked.error());
            return ApiResult.failure(checked.error());
        }
        AuditorRequest valid = checked.value();
        Instant now = clock.instant();
        String schedule = valid.schedule() != null ? valid.schedule() : AuditSchedule.MANUAL;
        boolean active = valid.isActive() == null || valid.isActive();
        AuditorDto auditor = new AuditorDto(UUID.randomUUID().toString(), projectId, blankToNull(valid.documentId()),
                valid.name(), valid.description(), active, schedule, 0, null,
                active ? AuditSchedule.nextRun(schedule, now, zone).orElse(null) : null,
                null, valid.instructions(), now, now);
        projectAuditors(projectId).put(auditor.id(), auditor);
        log.info("Created auditor {} '{}' in project {}", auditor.id(), auditor.name(), projectId);
        events.emit(projectId, ChangeEvent.EntityType.AUDITOR, auditor.id(),
                ChangeEvent.Action.CREATED, ChangeEvent.Origin.USER);
        return ApiResult.success(auditor);
    }

    /** Partial update: null fields of the request keep their current value. */
    public ApiResult<AuditorDto> update(String projectId, String auditorId, AuditorRequest request) {
        ApiResult<AuditorRequest> checked = AuditorValidator.validateUpdate(request);
        if (!checked.success()) {
            log.debug("Rejected auditor update {}: {}", auditorId, checked.error());
            return ApiResult.failure(checked.error());
        }
        AuditorRequest patch = checked.value();
        Instant now = clock.instant();
        AuditorDto updated = projectAuditors(projectId).computeIfPresent(auditorId, (id, current) -> {
            String schedule = patch.schedule() != null ? patch.schedule() : current.schedule();
            boolean active = patch.isActive() != null ? patch.isActive() : current.isActive();
            Instant nextRunAt = active ? AuditSchedule.nextRun(schedule, now, zone).orElse(null) : null;
            return new AuditorDto(id, projectId,
                    patch.documentId() != null ? blankToNull(patch.documentId()) : current.documentId(),
                    patch.name() != null ? patch.name() : current.name(),
                    patch.description() != null ? patch.description() : current.description(),
                    active, schedule, current.runCount(), current.lastRunAt(), nextRunAt, current.lastStatus(),
                    patch.instructions() != null ? patch.instructions() : current.instructions(),
                    current.createdAt(), now);
        });
        if (updated == null) return ApiResult.failure(NOT_FOUND);
        events.emit(projectId, ChangeEvent.EntityType.AUDITOR, auditorId,
                ChangeEvent.Action.UPDATED, ChangeEvent.Origin.USER);
        return ApiResult.success(updated);
    }

    public boolean delete(String projectId, String auditorId) {
        AuditorDto removed = projectAuditors(projectId).remove(auditorId);
        if (removed == null) return false;
        reports.remove(auditorId);
        log.info("Deleted auditor {} in project {}", auditorId, projectId);
        events.emit(projectId, ChangeEvent.EntityType.AUDITOR, auditorId,
                ChangeEvent.Action.DELETED, ChangeEvent.Origin.USER);
        return true;
    }

    public Optional<AuditorDto> get(String projectId, String auditorId) {
        return Optional.ofNullable(projectAuditors(projectId).get(auditorId));
    }

    public PageResult<AuditorDto> list(String projectId, int limit, int offset) {
        List<AuditorDto> all = new ArrayList<>(projectAuditors(projectId).values());
        all.sort(NEWEST_FIRST);
        return page(all, limit, offset);
    }

    /** Auditors scoped to one documentation page: the page's assessment objectives. */
    public List<AuditorDto> listForDocument(String projectId, String documentId) {
        return projectAuditors(projectId).values().stream()
                .filter(a -> documentId.equals(a.documentId()))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public PageResult<AuditReportDto> reports(String projectId, String auditorId, int limit, int offset) {
        if (get(projectId, auditorId).isEmpty()) return PageResult.empty(limit, offset);
        List<AuditReportDto> history = new ArrayList<>(reports.getOrDefault(auditorId, List.of()));
        history.sort(LATEST_REPORT_FIRST);
        return page(history, limit, offset);
    }

    public Optional<AuditReportDto> findReport(String auditorId, String reportId) {
        return reports.getOrDefault(auditorId, List.of()).stream()
                .filter(r -> r.id().equals(reportId))
                .findFirst();
    }

    /** Locates a report by id across the auditors of a project. */
    public Optional<AuditReportDto> findProjectReport(String projectId, String reportId) {
        for (String auditorId : projectAuditors(projectId).keySet()) {
            Optional<AuditReportDto> found = findReport(auditorId, reportId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /** Active auditors with a cron schedule whose next run is due at {@code now}, across every project. */
    public List<AuditorDto> dueAuditors(Instant now) {
        List<AuditorDto> due = new ArrayList<>();
        for (Map<String, AuditorDto> byId : auditors.values()) {
            for (AuditorDto auditor : byId.values()) {
                if (auditor.isActive() && !AuditSchedule.isManual(auditor.schedule())
                        && auditor.nextRunAt() != null && !auditor.nextRunAt().isAfter(now)) {
                    due.add(auditor);
                }
            }
        }
        return due;
    }

    // ---- Run bookkeeping, driven by AuditRunService ----

    /**
     * Records a new running report and bumps the run count. The running check and the insert happen under
     * the auditor's map entry, so two concurrent starts for one auditor yield exactly one report.
     */
    ApiResult<AuditReportDto> startRun(String projectId, String auditorId, AuditReportDto.Trigger trigger) {
        Instant now = clock.instant();
        AuditReportDto report = new AuditReportDto(UUID.randomUUID().toString(), auditorId,
                AuditReportDto.STATUS_RUNNING, 0, now, trigger.wireValue(), 0, List.of(), null, null);
        AtomicBoolean busy = new AtomicBoolean();
        AuditorDto updated = projectAuditors(projectId).computeIfPresent(auditorId, (id, a) -> {
            if (isRunning(id)) {
                busy.set(true);
                return a;
            }
            reports.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(report);
            return new AuditorDto(id, a.projectId(), a.documentId(), a.name(), a.description(), a.isActive(),
                    a.schedule(), a.runCount() + 1, now,
                    a.isActive() ? AuditSchedule.nextRun(a.schedule(), now, zone).orElse(null) : null,
                    AuditReportDto.STATUS_RUNNING, a.instructions(), a.createdAt(), a.updatedAt());
        });
        if (updated == null) return ApiResult.failure(NOT_FOUND);
        if (busy.get()) return ApiResult.failure(ALREADY_RUNNING);
        return ApiResult.success(report);
    }

    void finishRun(String projectId, AuditReportDto finished) {
        List<AuditReportDto> history = reports.get(finished.auditorId());
        if (history == null) return;
        history.replaceAll(r -> r.id().equals(finished.id()) ? finished : r);
        projectAuditors(projectId).computeIfPresent(finished.auditorId(), (id, a) ->
                new AuditorDto(id, a.projectId(), a.documentId(), a.name(), a.description(), a.isActive(),
                        a.schedule(), a.runCount(), a.lastRunAt(), a.nextRunAt(), finished.status(),
                        a.instructions(), a.createdAt(), a.updatedAt()));
    }

    /** Moves the next run time past {@code now} without recording a run. */
    void skipToNextRun(String projectId, String auditorId, Instant now) {
        projectAuditors(projectId).computeIfPresent(auditorId, (id, a) ->
                new AuditorDto(id, a.projectId(), a.documentId(), a.name(), a.description(), a.isActive(),
                        a.schedule(), a.runCount(), a.lastRunAt(),
                        AuditSchedule.nextRun(a.schedule(), now, zone).orElse(null), a.lastStatus(),
                        a.instructions(), a.createdAt(), a.updatedAt()));
    }

    boolean isRunning(String auditorId) {
        return reports.getOrDefault(auditorId, List.of()).stream()
                .anyMatch(r -> AuditReportDto.STATUS_RUNNING.equals(r.status()));
    }

    Instant now() {
        return clock.instant();
    }

    private Map<String, AuditorDto> projectAuditors(String projectId) {
        return auditors.computeIfAbsent(projectId, k -> new ConcurrentHashMap<>());
    }

    private static <T> PageResult<T> page(List<T> all, int limit, int offset) {
        int safeOffset = Math.max(0, offset);
        if (limit <= 0 || safeOffset >= all.size()) {
            return PageResult.of(List.of(), all.size(), limit, safeOffset);
        }
        int end = Math.min(all.size(), safeOffset + limit);
        return PageResult.of(List.copyOf(all.subList(safeOffset, end)), all.size(), limit, safeOffset);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
