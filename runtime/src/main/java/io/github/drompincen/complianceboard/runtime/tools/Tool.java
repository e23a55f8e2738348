package io.github.drompincen.complianceboard.runtime.tools;

import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * An action the assistant can take on a project. Implementations are discovered through
 * {@link java.util.ServiceLoader}; services they need arrive through single-argument setters.
 */
public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    Set<ToolRiskProfile> riskProfiles();

    default boolean mutatesProject() {
        return riskProfiles().contains(ToolRiskProfile.WRITE_PROJECT);
    }

    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);
}
