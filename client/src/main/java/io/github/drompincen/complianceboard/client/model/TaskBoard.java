package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.client.api.ApiCalls;
import io.github.drompincen.complianceboard.client.api.ComplianceApi;
import io.github.drompincen.complianceboard.client.state.*;
import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskStatus;
import io.github.drompincen.complianceboard.runtime.task.TaskDependencyGraph;
import io.github.drompincen.complianceboard.runtime.task.TaskStatusMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Kanban board of a project's tasks. Status changes from a field edit and from a drag into another lane both
 * go through {@link #updateStatus}; moves and deletes are applied locally first and rolled back when refused.
 */
public class TaskBoard {

    private static final Logger log = LoggerFactory.getLogger(TaskBoard.class);

    static final int LOAD_LIMIT = 500;

    private final ComplianceApi api;
    private final String projectId;
    private final Notifier notifier;
    private final Executor ui;
    private final Clock clock;

    private LoadState<List<ProjectTaskDto>> tasks = LoadState.idle();
    private String focusedTaskId;

    public TaskBoard(ComplianceApi api, String projectId, Notifier notifier, Executor ui) {
        this(api, projectId, notifier, ui, Clock.systemUTC());
    }

    public TaskBoard(ComplianceApi api, String projectId, Notifier notifier, Executor ui, Clock clock) {
        this.api = api;
        this.projectId = projectId;
        this.notifier = notifier;
        this.ui = ui;
        this.clock = clock;
    }

    // ---- Loading ----

    public CompletableFuture<Void> load() {
        tasks = LoadState.loading(tasks.value());
        return api.listTasks(projectId, TaskQuery.page(LOAD_LIMIT, 0)).handleAsync((page, error) -> {
            if (error != null) {
                tasks = LoadState.error(ApiCalls.message(error, "load tasks"), this::load);
            } else {
                tasks = LoadState.loaded(List.copyOf(page.items()));
            }
            return null;
        }, ui);
    }

    public Disposable bind(RefreshTrigger trigger) {
        return trigger.versions().subscribe(version -> ui.execute(this::load));
    }

    // ---- Mutations ----

    public CompletableFuture<ApiResult<ProjectTaskDto>> create(CreateTaskRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            return rejected("Title is required");
        }
        return ApiCalls.guard(() -> api.createTask(projectId, request), "create task")
                .thenApplyAsync(result -> {
                    if (result.success()) {
                        List<ProjectTaskDto> updated = new ArrayList<>(current());
                        updated.add(0, result.value());
                        tasks = LoadState.loaded(List.copyOf(updated));
                        notifier.success("Task created");
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                }, ui);
    }

    /**
     * Field edit. Local state changes once the server accepted it. Completing without any resolution reason is
     * refused before the call.
     */
    public CompletableFuture<ApiResult<ProjectTaskDto>> update(String taskId, UpdateTaskRequest request) {
        Optional<ProjectTaskDto> task = find(taskId);
        if (task.isEmpty()) return rejected("Task not found");
        if (request.status() != null) {
            ApiResult<ProjectTaskDto> check = TaskStatusMachine.transition(task.get(), request.status(),
                    request.resolutionReason(), clock.instant());
            if (!check.success()) return rejected(check.error());
        }
        return ApiCalls.guard(() -> api.updateTask(projectId, taskId, request), "update task")
                .thenApplyAsync(result -> {
                    if (result.success()) replace(result.value());
                    else notifier.error(result.error());
                    return result;
                }, ui);
    }

    /**
     * The single entry point for status changes. A move into the lane the task is already in succeeds without
     * a call and leaves {@code updatedAt} alone.
     */
    public CompletableFuture<ApiResult<ProjectTaskDto>> updateStatus(String taskId, TaskStatus status,
                                                                     String resolutionReason) {
        Optional<ProjectTaskDto> found = find(taskId);
        if (found.isEmpty()) return rejected("Task not found");
        ProjectTaskDto task = found.get();
        if (TaskStatusMachine.isNoOp(task, status)) return CompletableFuture.completedFuture(ApiResult.success(task));

        ApiResult<ProjectTaskDto> moved = TaskStatusMachine.transition(task, status, resolutionReason, clock.instant());
        if (!moved.success()) return rejected(moved.error());

        OptimisticMutation<LoadState<List<ProjectTaskDto>>> mutation = new OptimisticMutation<>(
                () -> tasks, previous -> tasks = previous, () -> replace(moved.value()));
        return mutation.execute(() -> api.updateTask(projectId, taskId,
                        UpdateTaskRequest.status(status, moved.value().resolutionReason())), ui, "update task")
                .thenApply(result -> {
                    if (result.success()) {
                        if (result.value() != null) replace(result.value());
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                });
    }

    /** Drag-and-drop into a lane. */
    public CompletableFuture<ApiResult<ProjectTaskDto>> moveToLane(String taskId, TaskStatus lane) {
        return updateStatus(taskId, lane, null);
    }

    public CompletableFuture<ApiResult<Void>> delete(String taskId) {
        if (find(taskId).isEmpty()) return rejected("Task not found");
        OptimisticMutation<LoadState<List<ProjectTaskDto>>> mutation = new OptimisticMutation<>(
                () -> tasks, previous -> tasks = previous,
                () -> tasks = LoadState.loaded(current().stream().filter(t -> !taskId.equals(t.id())).toList()));
        return mutation.execute(() -> api.deleteTask(projectId, taskId), ui, "delete task")
                .thenApply(result -> {
                    if (result.success()) {
                        if (taskId.equals(focusedTaskId)) focusedTaskId = null;
                        notifier.success("Task deleted");
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                });
    }

    // ---- Dependencies ----

    /** The live task {@code taskId} depends on; empty when it has none or the dependency is gone. */
    public Optional<ProjectTaskDto> dependencyOf(String taskId) {
        return new TaskDependencyGraph(current()).resolve(taskId);
    }

    public boolean isBlocked(String taskId) {
        return new TaskDependencyGraph(current()).isBlocked(taskId);
    }

    /** Focuses the dependency of {@code taskId}. Returns false when there is nothing to go to. */
    public boolean goToDependency(String taskId) {
        Optional<ProjectTaskDto> dependency = dependencyOf(taskId);
        dependency.ifPresent(d -> focusedTaskId = d.id());
        return dependency.isPresent();
    }

    public void focus(String taskId) {
        focusedTaskId = find(taskId).map(ProjectTaskDto::id).orElse(null);
    }

    // ---- Views ----

    public LoadState<List<ProjectTaskDto>> tasks() {
        return tasks;
    }

    /** Tasks per lane, lanes in board order, tasks in list order. */
    public Map<TaskStatus, List<ProjectTaskDto>> lanes() {
        Map<TaskStatus, List<ProjectTaskDto>> lanes = new LinkedHashMap<>();
        for (TaskStatus lane : TaskStatusMachine.LANES) lanes.put(lane, new ArrayList<>());
        for (ProjectTaskDto task : current()) {
            lanes.computeIfAbsent(task.status(), k -> new ArrayList<>()).add(task);
        }
        lanes.replaceAll((k, v) -> List.copyOf(v));
        return lanes;
    }

    public Optional<ProjectTaskDto> find(String taskId) {
        if (taskId == null) return Optional.empty();
        return current().stream().filter(t -> taskId.equals(t.id())).findFirst();
    }

    public String focusedTaskId() {
        return focusedTaskId;
    }

    // ---- Internals ----

    private List<ProjectTaskDto> current() {
        List<ProjectTaskDto> value = tasks.value();
        return value != null ? value : List.of();
    }

    private void replace(ProjectTaskDto task) {
        List<ProjectTaskDto> updated = new ArrayList<>(current());
        updated.replaceAll(t -> t.id().equals(task.id()) ? task : t);
        tasks = LoadState.loaded(List.copyOf(updated));
    }

    private <T> CompletableFuture<ApiResult<T>> rejected(String error) {
        log.debug("Task change rejected: {}", error);
        notifier.error(error);
        return CompletableFuture.completedFuture(ApiResult.failure(error));
    }
}
