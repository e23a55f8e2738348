package io.github.drompincen.complianceboard.runtime.tools;

import java.util.Map;

/**
 * @param projectId  project the tool acts on
 * @param invokedBy  free-form caller label, for logs
 * @param attributes extra caller-supplied values
 */
public record ToolContext(
        String projectId,
        String invokedBy,
        Map<String, String> attributes
) {
    public static ToolContext forProject(String projectId) {
        return new ToolContext(projectId, "assistant", Map.of());
    }
}
