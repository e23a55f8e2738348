package io.github.drompincen.complianceboard.gateway.controller;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceEntry;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceControllerTest {

    private static final String PROJECT = "proj";

    private EvidenceController controller;
    private DocumentService documentService;
    private String pageId;

    @BeforeEach
    void setUp() {
        ProjectEventPublisher events = new ProjectEventPublisher();
        EvidenceService evidenceService = new EvidenceService(events);
        documentService = new DocumentService(evidenceService, events, ComplianceBoardProperties.defaults());
        controller = new EvidenceController(documentService, evidenceService);
        pageId = documentService.createRoot(PROJECT, "Access control", ChangeEvent.Origin.USER).id();
    }

    @Test
    void evidenceOnMissingPageIs404() {
        assertThat(controller.addEvidence(PROJECT, "ghost", evidence("MFA config")).getStatusCode().value())
                .isEqualTo(404);
        assertThat(controller.evidence(PROJECT, "ghost").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.timeline(PROJECT, "ghost").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void namelessEvidenceIsABadRequest() {
        assertThat(controller.addEvidence(PROJECT, pageId, evidence(" ")).getStatusCode().value()).isEqualTo(400);
    }

    @Test
    void timelineListsRequestsBeforeEvidence() {
        controller.addEvidence(PROJECT, pageId, evidence("MFA config"));
        controller.addRequest(PROJECT, pageId, request("Quarterly access review", null));

        assertThat(controller.timeline(PROJECT, pageId).getBody()).extracting(EvidenceEntry::kind)
                .containsExactly(EvidenceEntry.Kind.REQUEST, EvidenceEntry.Kind.EVIDENCE);
    }

    @Test
    void openRequestSearchSkipsCompletedAndMatchesTitle() {
        controller.addRequest(PROJECT, pageId, request("Access review export", "completed"));
        controller.addRequest(PROJECT, pageId, request("Access review sign-off", null));
        controller.addRequest(PROJECT, pageId, request("Firewall export", "in progress"));

        assertThat(controller.searchOpen(PROJECT, "ACCESS", 10)).extracting(EvidenceRequestDto::title)
                .containsExactly("Access review sign-off");
        assertThat(controller.searchOpen(PROJECT, null, 1)).hasSize(1);
    }

    @Test
    void deletingThePageDropsItsEvidence() {
        controller.addEvidence(PROJECT, pageId, evidence("MFA config"));
        controller.addRequest(PROJECT, pageId, request("Access review sign-off", null));
        documentService.delete(PROJECT, pageId, ChangeEvent.Origin.USER);

        assertThat(controller.searchOpen(PROJECT, null, 10)).isEmpty();
        assertThat(controller.evidence(PROJECT, pageId).getStatusCode().value()).isEqualTo(404);
    }

    private static EvidenceDto evidence(String name) {
        return new EvidenceDto(null, null, name, null, "text", TextNode.valueOf("enforced"), null, null);
    }

    private static EvidenceRequestDto request(String title, String status) {
        return new EvidenceRequestDto(null, null, title, null, status, LocalDate.of(2026, 12, 1), null);
    }
}
