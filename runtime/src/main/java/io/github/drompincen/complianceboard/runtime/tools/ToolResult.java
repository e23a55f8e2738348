package io.github.drompincen.complianceboard.runtime.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;

import java.util.List;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> notes
) {
    public ToolResult {
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, List.of());
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, List.of());
    }

    /** Carries a service outcome over to the tool surface, serializing its value on success. */
    public static ToolResult from(ApiResult<?> result, ObjectMapper mapper) {
        if (!result.success()) return failure(result.error());
        return success(result.value() != null ? mapper.valueToTree(result.value()) : mapper.nullNode());
    }

    public ToolResult withNotes(List<String> notes) {
        return new ToolResult(success, output, error, notes);
    }
}
