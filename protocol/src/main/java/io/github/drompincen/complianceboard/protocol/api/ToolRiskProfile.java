package io.github.drompincen.complianceboard.protocol.api;

public enum ToolRiskProfile {
    READ_ONLY,
    AGENT_INTERNAL,
    WRITE_PROJECT
}
