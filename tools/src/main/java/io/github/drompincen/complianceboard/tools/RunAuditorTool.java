package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.AuditReportDto;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.runtime.auditor.AuditRunService;
import io.github.drompincen.complianceboard.runtime.tools.*;

import java.util.Set;

import static io.github.drompincen.complianceboard.tools.ToolInputs.MAPPER;

/** Starts an auditor run. The run finishes in the background; the result is the {@code running} report. */
public class RunAuditorTool implements Tool {

    private AuditRunService auditRunService;

    @Override public String name() { return "run_auditor"; }
    @Override public String description() {
        return "Run a compliance auditor against its evidence. Returns the running report; the verdict "
                + "arrives as a change event when evaluation finishes";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("auditorId").put("type", "string");
        schema.putArray("required").add("auditorId");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_PROJECT); }

    public void setAuditRunService(AuditRunService auditRunService) {
        this.auditRunService = auditRunService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (auditRunService == null) return ToolResult.failure("Audit run service not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'projectId' is required");
        String auditorId = ToolInputs.text(input, "auditorId");
        if (auditorId == null) return ToolResult.failure("'auditorId' is required");

        ApiResult<AuditReportDto> started = auditRunService.run(projectId, auditorId, AuditReportDto.Trigger.ASSISTANT);
        if (started.success()) stream.note("Audit run " + started.value().id() + " started");
        return ToolResult.from(started, MAPPER);
    }
}
