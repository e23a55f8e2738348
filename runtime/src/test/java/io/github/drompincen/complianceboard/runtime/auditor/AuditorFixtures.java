package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.AuditorInstructions;
import io.github.drompincen.complianceboard.protocol.api.AuditorRequest;

import java.util.List;

final class AuditorFixtures {

    private AuditorFixtures() {}

    static AuditorInstructions.Requirement requirement(String id, String title, double weight) {
        return new AuditorInstructions.Requirement(id, title, "desc", "ctx",
                List.of("MFA enforced for admins"), List.of("no MFA enforced"), weight);
    }

    static AuditorInstructions sixtyForty() {
        return new AuditorInstructions(80, List.of(
                requirement("r1", "MFA", 60),
                requirement("r2", "Access reviews", 40)), null);
    }

    static AuditorRequest request(String name, String schedule, AuditorInstructions instructions) {
        return new AuditorRequest(name, "checks access", schedule, true, null, instructions);
    }
}
