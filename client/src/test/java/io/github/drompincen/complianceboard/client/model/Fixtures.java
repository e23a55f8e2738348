package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskPriority;
import io.github.drompincen.complianceboard.protocol.api.ProjectTaskDto.TaskStatus;

import java.time.Instant;
import java.util.List;

final class Fixtures {

    static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private Fixtures() {}

    static DocumentPageDto page(String id, String parentId, String title, int order, DocumentPageDto... children) {
        return new DocumentPageDto(id, parentId, title, "# " + title, order, T0, T0, null, null, null, null, null,
                null, null, List.of(children));
    }

    static FullDocumentDto full(DocumentPageDto page) {
        return new FullDocumentDto(page, List.of(), List.of(), page.children(), List.of());
    }

    static ProjectTaskDto task(String id, String title, TaskStatus status, String dependsOn) {
        return new ProjectTaskDto(id, "p1", title, null, status, TaskPriority.MEDIUM, null, null, null, null,
                dependsOn, null, null, T0, T0);
    }

    static AuditorDto auditor(String id, String name) {
        return new AuditorDto(id, "p1", null, name, null, true, "manual", 0, null, null, null,
                new AuditorInstructions(80, List.of(requirement("MFA")), null), T0, T0);
    }

    static AuditorInstructions.Requirement requirement(String title) {
        return new AuditorInstructions.Requirement(null, title, null, null, List.of("MFA enforced"),
                List.of("No MFA"), 100);
    }
}
