package io.github.drompincen.complianceboard.protocol.api;

import java.time.LocalDate;

/**
 * Partial task update. Null fields are left untouched; an empty {@code dependsOnTaskId},
 * {@code documentId} or {@code evidenceRequestId} clears the reference.
 */
public record UpdateTaskRequest(
        String title,
        String description,
        ProjectTaskDto.TaskStatus status,
        ProjectTaskDto.TaskPriority priority,
        LocalDate dueDate,
        String resolutionReason,
        String notes,
        String dependsOnTaskId,
        String documentId,
        String evidenceRequestId
) {
    public static UpdateTaskRequest status(ProjectTaskDto.TaskStatus status, String resolutionReason) {
        return new UpdateTaskRequest(null, null, status, null, null, resolutionReason, null, null, null, null);
    }
}
