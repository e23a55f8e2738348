package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema,
        Set<ToolRiskProfile> riskProfiles,
        boolean mutatesProject
) {}
