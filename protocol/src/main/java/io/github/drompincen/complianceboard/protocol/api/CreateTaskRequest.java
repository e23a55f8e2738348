package io.github.drompincen.complianceboard.protocol.api;

import java.time.LocalDate;

public record CreateTaskRequest(
        String title,
        String description,
        ProjectTaskDto.TaskPriority priority,
        ProjectTaskDto.TaskStatus status,
        LocalDate dueDate,
        String notes,
        String documentId,
        String evidenceRequestId,
        String dependsOnTaskId
) {
    public static CreateTaskRequest of(String title, ProjectTaskDto.TaskPriority priority) {
        return new CreateTaskRequest(title, null, priority, ProjectTaskDto.TaskStatus.TODO,
                null, null, null, null, null);
    }
}
