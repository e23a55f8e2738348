package io.github.drompincen.complianceboard.runtime.task;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Kanban status rules. Every status can move to every other one; moving into {@code completed} needs a
 * resolution reason and stamps the resolution date. Reason and date survive leaving {@code completed}.
 */
public final class TaskStatusMachine {

    public static final String REASON_REQUIRED = "Resolution reason is required to complete a task";

    /** Board lanes, left to right. */
    public static final List<TaskStatus> LANES =
            List.of(TaskStatus.TODO, TaskStatus.IN_PROGRESS, TaskStatus.STUCK, TaskStatus.COMPLETED);

    private TaskStatusMachine() {}

    public static boolean isNoOp(ProjectTaskDto task, TaskStatus newStatus) {
        return newStatus == null || task.status() == newStatus;
    }

    /**
     * Applies a status change. A same-status move returns the task untouched. When completing, an omitted
     * ({@code null}) {@code resolutionReason} falls back to the reason already on the task; a blank one is
     * refused.
     */
    public static ApiResult<ProjectTaskDto> transition(ProjectTaskDto task, TaskStatus newStatus,
                                                       String resolutionReason, Instant now) {
        if (isNoOp(task, newStatus)) return ApiResult.success(task);

        if (newStatus == TaskStatus.COMPLETED) {
            String reason = resolutionReason != null ? nonBlank(resolutionReason) : nonBlank(task.resolutionReason());
            if (reason == null) return ApiResult.failure(REASON_REQUIRED);
            return ApiResult.success(task.withStatus(newStatus, reason, now, now));
        }
        return ApiResult.success(task.withStatus(newStatus, task.resolutionReason(), task.resolutionDate(), now));
    }

    static String nonBlank(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
