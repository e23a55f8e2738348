package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.complianceboard.protocol.api.PageResult;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto;
import io.github.drompincen.complianceboard.protocol.api.TaskQuery;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.runtime.task.ProjectTaskService;
import io.github.drompincen.complianceboard.runtime.tools.*;

import java.util.Set;

import static io.github.drompincen.complianceboard.tools.ToolInputs.MAPPER;

public class ListProjectTasksTool implements Tool {

    private ProjectTaskService taskService;

    @Override public String name() { return "list_project_tasks"; }
    @Override public String description() {
        return "List project tasks newest first, optionally filtered by status or searched by title";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("status").put("type", "string").put("description", "todo, in-progress, stuck, completed");
        props.putObject("q").put("type", "string").put("description", "Title search; returns the top matches");
        props.putObject("limit").put("type", "integer");
        props.putObject("offset").put("type", "integer");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setProjectTaskService(ProjectTaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (taskService == null) return ToolResult.failure("Task service not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'projectId' is required");

        ProjectTaskDto.TaskStatus status;
        try {
            status = ProjectTaskDto.TaskStatus.fromWire(ToolInputs.text(input, "status"));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
        TaskQuery query = new TaskQuery(ToolInputs.integer(input, "limit"), ToolInputs.integer(input, "offset"),
                status, ToolInputs.rawText(input, "q"));
        PageResult<ProjectTaskDto> page = taskService.list(projectId, query);
        return ToolResult.success(MAPPER.valueToTree(page));
    }
}
