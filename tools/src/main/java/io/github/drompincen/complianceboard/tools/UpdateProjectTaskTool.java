package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.protocol.api.UpdateTaskRequest;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.task.ProjectTaskService;
import io.github.drompincen.complianceboard.runtime.tools.*;

import java.util.Set;

import static io.github.drompincen.complianceboard.tools.ToolInputs.MAPPER;

/**
 * Partial task update. Fields left out of the input are kept; an empty string for a reference id clears it.
 * Completing a task needs a {@code resolutionReason}.
 */
public class UpdateProjectTaskTool implements Tool {

    private ProjectTaskService taskService;

    @Override public String name() { return "update_project_task"; }
    @Override public String description() {
        return "Update a project task: move it between todo, in-progress, stuck and completed, "
                + "or change its details and links";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("taskId").put("type", "string");
        props.putObject("title").put("type", "string");
        props.putObject("description").put("type", "string");
        props.putObject("status").put("type", "string").put("description", "todo, in-progress, stuck, completed");
        props.putObject("resolutionReason").put("type", "string")
                .put("description", "Required when status is completed");
        props.putObject("priority").put("type", "string").put("description", "low, medium, high, critical");
        props.putObject("dueDate").put("type", "string");
        props.putObject("notes").put("type", "string");
        props.putObject("dependsOnTaskId").put("type", "string").put("description", "Empty string clears it");
        props.putObject("documentId").put("type", "string").put("description", "Empty string clears it");
        props.putObject("evidenceRequestId").put("type", "string").put("description", "Empty string clears it");
        schema.putArray("required").add("taskId");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_PROJECT); }

    public void setProjectTaskService(ProjectTaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (taskService == null) return ToolResult.failure("Task service not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'projectId' is required");
        String taskId = ToolInputs.text(input, "taskId");
        if (taskId == null) return ToolResult.failure("'taskId' is required");

        UpdateTaskRequest request;
        try {
            request = new UpdateTaskRequest(ToolInputs.rawText(input, "title"),
                    ToolInputs.rawText(input, "description"),
                    ProjectTaskDto.TaskStatus.fromWire(ToolInputs.text(input, "status")),
                    ProjectTaskDto.TaskPriority.fromWire(ToolInputs.text(input, "priority")),
                    ToolInputs.date(input, "dueDate"), ToolInputs.rawText(input, "resolutionReason"),
                    ToolInputs.rawText(input, "notes"), ToolInputs.rawText(input, "dependsOnTaskId"),
                    ToolInputs.rawText(input, "documentId"), ToolInputs.rawText(input, "evidenceRequestId"));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }

        ApiResult<ProjectTaskDto> updated = taskService.update(projectId, taskId, request, ChangeEvent.Origin.ASSISTANT);
        if (updated.success()) stream.progress(100, "Task updated: " + updated.value().title());
        return ToolResult.from(updated, MAPPER);
    }
}
