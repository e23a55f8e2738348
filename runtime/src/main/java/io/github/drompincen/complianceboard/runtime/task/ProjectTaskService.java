package io.github.drompincen.complianceboard.runtime.task;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskPriority;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskStatus;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Project follow-up tasks. Document and evidence request references are weak ids: they are not checked and
 * survive deletion of what they point at. Mutations of one project are serialized on that project's map.
 */
@Service
public class ProjectTaskService {

    private static final Logger log = LoggerFactory.getLogger(ProjectTaskService.class);

    public static final String NOT_FOUND = "Task not found";
    public static final String TITLE_REQUIRED = "Title is required";

    private final Map<String, Map<String, ProjectTaskDto>> tasks = new ConcurrentHashMap<>();
    private final ProjectEventPublisher events;
    private final ComplianceBoardProperties.Tasks settings;
    private final Clock clock;

    @Autowired
    public ProjectTaskService(ProjectEventPublisher events, ComplianceBoardProperties properties) {
        this(events, properties, Clock.systemUTC());
    }

    public ProjectTaskService(ProjectEventPublisher events, ComplianceBoardProperties properties, Clock clock) {
        this.events = events;
        this.settings = properties.tasks();
        this.clock = clock;
    }

    public ApiResult<ProjectTaskDto> create(String projectId, CreateTaskRequest request, ChangeEvent.Origin origin) {
        if (request == null || TaskStatusMachine.nonBlank(request.title()) == null) {
            return ApiResult.failure(TITLE_REQUIRED);
        }
        Map<String, ProjectTaskDto> projectTasks = projectTasks(projectId);
        ProjectTaskDto task;
        synchronized (projectTasks) {
            String dependsOn = TaskStatusMachine.nonBlank(request.dependsOnTaskId());
            if (dependsOn != null) {
                Optional<String> edgeError = graph(projectTasks).validateEdge(null, dependsOn);
                if (edgeError.isPresent()) return ApiResult.failure(edgeError.get());
            }
            TaskStatus status = request.status() != null ? request.status() : TaskStatus.TODO;
            if (status == TaskStatus.COMPLETED) {
                return ApiResult.failure(TaskStatusMachine.REASON_REQUIRED);
            }
            Instant now = clock.instant();
            task = new ProjectTaskDto(UUID.randomUUID().toString(), projectId, request.title().trim(),
                    request.description(), status,
                    request.priority() != null ? request.priority() : TaskPriority.MEDIUM,
                    request.dueDate(), null, null, request.notes(), dependsOn,
                    TaskStatusMachine.nonBlank(request.documentId()),
                    TaskStatusMachine.nonBlank(request.evidenceRequestId()), now, now);
            projectTasks.put(task.id(), task);
        }
        log.info("Created task {} '{}' in project {}", task.id(), task.title(), projectId);
        emit(projectId, task.id(), ChangeEvent.Action.CREATED, origin);
        return ApiResult.success(task);
    }

    /**
     * Partial update. Null fields are kept; an empty reference id clears it. An update that changes nothing
     * returns the task as it was, without touching {@code updatedAt}.
     */
    public ApiResult<ProjectTaskDto> update(String projectId, String taskId, UpdateTaskRequest request,
                                            ChangeEvent.Origin origin) {
        if (request == null) return ApiResult.failure("Invalid request");
        Map<String, ProjectTaskDto> projectTasks = projectTasks(projectId);
        ProjectTaskDto current;
        ProjectTaskDto updated;
        synchronized (projectTasks) {
            current = projectTasks.get(taskId);
            if (current == null) return ApiResult.failure(NOT_FOUND);

            String title = current.title();
            if (request.title() != null) {
                title = TaskStatusMachine.nonBlank(request.title());
                if (title == null) return ApiResult.failure(TITLE_REQUIRED);
            }

            String dependsOn = current.dependsOnTaskId();
            if (request.dependsOnTaskId() != null) {
                dependsOn = TaskStatusMachine.nonBlank(request.dependsOnTaskId());
                if (dependsOn != null && !dependsOn.equals(current.dependsOnTaskId())) {
                    Optional<String> edgeError = graph(projectTasks).validateEdge(taskId, dependsOn);
                    if (edgeError.isPresent()) return ApiResult.failure(edgeError.get());
                }
            }

            Instant now = clock.instant();
            ProjectTaskDto base = current;
            if (!TaskStatusMachine.isNoOp(current, request.status())) {
                ApiResult<ProjectTaskDto> moved = TaskStatusMachine.transition(current, request.status(),
                        request.resolutionReason(), now);
                if (!moved.success()) return moved;
                base = moved.value();
            }
            String reason = base.resolutionReason();
            if (base == current && request.resolutionReason() != null) {
                reason = TaskStatusMachine.nonBlank(request.resolutionReason());
                if (reason == null && current.status() == TaskStatus.COMPLETED) {
                    return ApiResult.failure(TaskStatusMachine.REASON_REQUIRED);
                }
            }

            ProjectTaskDto candidate = new ProjectTaskDto(current.id(), projectId, title,
                    request.description() != null ? request.description() : base.description(),
                    base.status(),
                    request.priority() != null ? request.priority() : base.priority(),
                    request.dueDate() != null ? request.dueDate() : base.dueDate(),
                    reason, base.resolutionDate(),
                    request.notes() != null ? request.notes() : base.notes(),
                    dependsOn,
                    request.documentId() != null ? TaskStatusMachine.nonBlank(request.documentId()) : base.documentId(),
                    request.evidenceRequestId() != null
                            ? TaskStatusMachine.nonBlank(request.evidenceRequestId()) : base.evidenceRequestId(),
                    current.createdAt(), current.updatedAt());
            if (candidate.equals(current)) return ApiResult.success(current);

            updated = new ProjectTaskDto(candidate.id(), projectId, candidate.title(), candidate.description(),
                    candidate.status(), candidate.priority(), candidate.dueDate(), candidate.resolutionReason(),
                    candidate.resolutionDate(), candidate.notes(), candidate.dependsOnTaskId(),
                    candidate.documentId(), candidate.evidenceRequestId(), candidate.createdAt(), now);
            projectTasks.put(taskId, updated);
        }
        if (current.status() != updated.status()) {
            log.info("Task {} moved {} -> {}", taskId, current.status().wire(), updated.status().wire());
        }
        emit(projectId, taskId, ChangeEvent.Action.UPDATED, origin);
        return ApiResult.success(updated);
    }

    public ApiResult<ProjectTaskDto> updateStatus(String projectId, String taskId, TaskStatus status,
                                                  String resolutionReason, ChangeEvent.Origin origin) {
        return update(projectId, taskId, UpdateTaskRequest.status(status, resolutionReason), origin);
    }

    /** Deletes a task; tasks that depended on it lose their edge. */
    public boolean delete(String projectId, String taskId, ChangeEvent.Origin origin) {
        Map<String, ProjectTaskDto> projectTasks = projectTasks(projectId);
        List<String> released = new ArrayList<>();
        synchronized (projectTasks) {
            if (projectTasks.remove(taskId) == null) return false;
            Instant now = clock.instant();
            projectTasks.replaceAll((id, t) -> {
                if (!taskId.equals(t.dependsOnTaskId())) return t;
                released.add(id);
                return new ProjectTaskDto(t.id(), t.projectId(), t.title(), t.description(), t.status(),
                        t.priority(), t.dueDate(), t.resolutionReason(), t.resolutionDate(), t.notes(), null,
                        t.documentId(), t.evidenceRequestId(), t.createdAt(), now);
            });
        }
        log.info("Deleted task {} in project {}", taskId, projectId);
        emit(projectId, taskId, ChangeEvent.Action.DELETED, origin);
        released.forEach(id -> emit(projectId, id, ChangeEvent.Action.UPDATED, origin));
        return true;
    }

    public Optional<ProjectTaskDto> get(String projectId, String taskId) {
        return Optional.ofNullable(projectTasks(projectId).get(taskId));
    }

    /**
     * Newest first. When the query carries {@code q}, even an empty one, only the top search results are
     * returned from offset 0; a non-empty {@code q} filters titles case-insensitively.
     */
    public PageResult<ProjectTaskDto> list(String projectId, TaskQuery query) {
        TaskQuery q = query != null ? query : new TaskQuery(null, null, null, null);
        List<ProjectTaskDto> matching = new ArrayList<>(snapshot(projectId));
        if (q.status() != null) matching.removeIf(t -> t.status() != q.status());

        if (q.hasQuery()) {
            String needle = q.q().trim().toLowerCase(Locale.ROOT);
            if (!needle.isEmpty()) {
                matching.removeIf(t -> !t.title().toLowerCase(Locale.ROOT).contains(needle));
            }
            int limit = settings.searchResultLimit();
            return PageResult.of(List.copyOf(matching.subList(0, Math.min(limit, matching.size()))),
                    matching.size(), limit, 0);
        }

        int limit = q.limit() == null || q.limit() <= 0
                ? settings.defaultPageSize() : Math.min(q.limit(), settings.maxPageSize());
        int offset = q.offset() == null ? 0 : Math.max(0, q.offset());
        if (offset >= matching.size()) return PageResult.of(List.of(), matching.size(), limit, offset);
        int end = Math.min(matching.size(), offset + limit);
        return PageResult.of(List.copyOf(matching.subList(offset, end)), matching.size(), limit, offset);
    }

    public TaskDependencyGraph graph(String projectId) {
        return new TaskDependencyGraph(snapshot(projectId));
    }

    // Newest first; ties keep the later-created task first.
    private List<ProjectTaskDto> snapshot(String projectId) {
        Map<String, ProjectTaskDto> projectTasks = projectTasks(projectId);
        List<ProjectTaskDto> all;
        synchronized (projectTasks) {
            all = new ArrayList<>(projectTasks.values());
        }
        Collections.reverse(all);
        all.sort(Comparator.comparing(ProjectTaskDto::createdAt).reversed());
        return all;
    }

    private TaskDependencyGraph graph(Map<String, ProjectTaskDto> projectTasks) {
        return new TaskDependencyGraph(projectTasks.values());
    }

    private Map<String, ProjectTaskDto> projectTasks(String projectId) {
        return tasks.computeIfAbsent(projectId, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    private void emit(String projectId, String taskId, ChangeEvent.Action action, ChangeEvent.Origin origin) {
        events.emit(projectId, ChangeEvent.EntityType.TASK, taskId, action,
                origin != null ? origin : ChangeEvent.Origin.USER);
    }
}
