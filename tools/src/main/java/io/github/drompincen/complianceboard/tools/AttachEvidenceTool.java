package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import io.github.drompincen.complianceboard.runtime.tools.*;

import java.util.Set;

import static io.github.drompincen.complianceboard.tools.ToolInputs.MAPPER;

public class AttachEvidenceTool implements Tool {

    private DocumentService documentService;
    private EvidenceService evidenceService;

    @Override public String name() { return "attach_evidence"; }

    @Override public String description() {
        return "Attach an evidence item (a text, number or JSON value) to a documentation page so auditors can "
                + "evaluate it.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("documentId").put("type", "string");
        props.putObject("name").put("type", "string")
                .put("description", "Human-readable label for the evidence");
        props.putObject("description").put("type", "string");
        props.putObject("valueType").put("type", "string")
                .put("description", "text, number, boolean or json");
        props.putObject("value").put("description", "The evidence value itself");
        schema.putArray("required").add("documentId").add("name");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_PROJECT); }

    public void setDocumentService(DocumentService documentService) {
        this.documentService = documentService;
    }

    public void setEvidenceService(EvidenceService evidenceService) {
        this.evidenceService = evidenceService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (documentService == null || evidenceService == null) {
            return ToolResult.failure("Evidence services not available");
        }
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'projectId' is required");
        String documentId = ToolInputs.text(input, "documentId");
        if (documentId == null) return ToolResult.failure("'documentId' is required");
        if (!documentService.exists(projectId, documentId)) return ToolResult.failure("Document not found");

        JsonNode value = input.path("value");
        EvidenceDto request = new EvidenceDto(null, documentId, ToolInputs.text(input, "name"),
                ToolInputs.text(input, "description"), ToolInputs.text(input, "valueType"),
                value.isMissingNode() || value.isNull() ? null : value, null, null);
        ApiResult<EvidenceDto> added = evidenceService.addEvidence(projectId, documentId, request,
                ChangeEvent.Origin.ASSISTANT);
        if (added.success()) stream.progress(100, "Evidence attached: " + added.value().name());
        return ToolResult.from(added, MAPPER);
    }
}
