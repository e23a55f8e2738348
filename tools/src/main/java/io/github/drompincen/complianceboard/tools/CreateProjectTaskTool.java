package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.task.ProjectTaskService;
import io.github.drompincen.complianceboard.runtime.tools.*;

import java.util.Set;

import static io.github.drompincen.complianceboard.tools.ToolInputs.MAPPER;

public class CreateProjectTaskTool implements Tool {

    private ProjectTaskService taskService;

    @Override public String name() { return "create_project_task"; }
    @Override public String description() {
        return "Create a follow-up task in the project, optionally linked to a documentation page, "
                + "an evidence request or another task it depends on";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("title").put("type", "string");
        props.putObject("description").put("type", "string");
        props.putObject("priority").put("type", "string").put("description", "low, medium, high, critical");
        props.putObject("status").put("type", "string").put("description", "todo, in-progress, stuck");
        props.putObject("dueDate").put("type", "string").put("description", "ISO date, e.g. 2026-03-31");
        props.putObject("notes").put("type", "string");
        props.putObject("documentId").put("type", "string");
        props.putObject("evidenceRequestId").put("type", "string");
        props.putObject("dependsOnTaskId").put("type", "string");
        schema.putArray("required").add("title");
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
        String title = ToolInputs.text(input, "title");
        if (title == null) return ToolResult.failure("'title' is required");

        CreateTaskRequest request;
        try {
            request = new CreateTaskRequest(title, ToolInputs.text(input, "description"),
                    ProjectTaskDto.TaskPriority.fromWire(ToolInputs.text(input, "priority")),
                    ProjectTaskDto.TaskStatus.fromWire(ToolInputs.text(input, "status")),
                    ToolInputs.date(input, "dueDate"), ToolInputs.text(input, "notes"),
                    ToolInputs.text(input, "documentId"), ToolInputs.text(input, "evidenceRequestId"),
                    ToolInputs.text(input, "dependsOnTaskId"));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }

        ApiResult<ProjectTaskDto> created = taskService.create(projectId, request, ChangeEvent.Origin.ASSISTANT);
        if (created.success()) stream.progress(100, "Task created: " + created.value().title());
        return ToolResult.from(created, MAPPER);
    }
}
