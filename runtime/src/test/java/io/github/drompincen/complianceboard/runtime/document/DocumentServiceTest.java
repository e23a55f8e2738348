package io.github.drompincen.complianceboard.runtime.document;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.MutableClock;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentServiceTest {

    private static final String PROJECT = "proj-1";

    private ProjectEventPublisher events;
    private EvidenceService evidenceService;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-03-01T09:00:00Z");
        AtomicInteger ids = new AtomicInteger();
        events = new ProjectEventPublisher(clock);
        evidenceService = new EvidenceService(events, clock);
        service = new DocumentService(evidenceService, events, ComplianceBoardProperties.defaults(),
                clock, () -> "doc-" + ids.incrementAndGet());
    }

    @Test
    void projectsHaveSeparateTrees() {
        service.createRoot(PROJECT, "Access Control", ChangeEvent.Origin.USER);
        service.createRoot("other", "Access Control", ChangeEvent.Origin.USER);

        assertThat(service.getDocumentTree(PROJECT)).hasSize(1);
        assertThat(service.getDocumentTree("other")).hasSize(1);
        assertThat(service.getDocumentTree("empty")).isEmpty();
    }

    @Test
    void fullDocumentCarriesEvidenceChildrenAndRelations() {
        DocumentPageDto control = service.createRoot(PROJECT, "AC-1", ChangeEvent.Origin.USER);
        DocumentPageDto risk = service.createRoot(PROJECT, "Credential theft", ChangeEvent.Origin.USER);
        service.update(PROJECT, risk.id(), new DocumentMetadataUpdate(null, null, "risk", null, null, null,
                null, null, null), ChangeEvent.Origin.USER);
        service.addChild(PROJECT, control.id(), "Procedure", ChangeEvent.Origin.USER);
        evidenceService.addEvidence(PROJECT, control.id(), evidence("MFA config"));
        evidenceService.addRequest(PROJECT, control.id(), request("Access review export"));
        service.relate(PROJECT, control.id(), new RelationRequest(risk.id(), "mitigates"));

        FullDocumentDto full = service.getFullDocument(PROJECT, control.id()).orElseThrow();

        assertThat(full.document().title()).isEqualTo("AC-1");
        assertThat(full.children()).extracting(DocumentPageDto::title).containsExactly("Procedure");
        assertThat(full.evidence()).extracting(EvidenceDto::name).containsExactly("MFA config");
        assertThat(full.evidenceRequests()).extracting(EvidenceRequestDto::title).containsExactly("Access review export");
        assertThat(full.relatedPages()).singleElement().satisfies(r -> {
            assertThat(r.title()).isEqualTo("Credential theft");
            assertThat(r.pageKind()).isEqualTo("risk");
            assertThat(r.relationType()).isEqualTo("mitigates");
        });
    }

    @Test
    void danglingRelationsAreSkipped() {
        DocumentPageDto a = service.createRoot(PROJECT, "A", ChangeEvent.Origin.USER);
        DocumentPageDto b = service.createRoot(PROJECT, "B", ChangeEvent.Origin.USER);
        service.relate(PROJECT, a.id(), new RelationRequest(b.id(), "implements"));

        service.delete(PROJECT, b.id(), ChangeEvent.Origin.USER);

        assertThat(service.relatedPages(PROJECT, a.id())).isEmpty();
        assertThat(service.getFullDocument(PROJECT, a.id()).orElseThrow().relatedPages()).isEmpty();
    }

    @Test
    void relateRejectsSelfAndUnknownPages() {
        DocumentPageDto a = service.createRoot(PROJECT, "A", ChangeEvent.Origin.USER);

        assertThat(service.relate(PROJECT, a.id(), new RelationRequest(a.id(), null)).error())
                .isEqualTo("A page cannot be related to itself");
        assertThat(service.relate(PROJECT, a.id(), new RelationRequest("ghost", null)).error())
                .isEqualTo("Document not found");
    }

    @Test
    void deleteDropsEvidenceOfTheWholeSubtree() {
        DocumentPageDto root = service.createRoot(PROJECT, "Root", ChangeEvent.Origin.USER);
        DocumentPageDto child = service.addChild(PROJECT, root.id(), "Child", ChangeEvent.Origin.USER).orElseThrow();
        DocumentPageDto keep = service.createRoot(PROJECT, "Keep", ChangeEvent.Origin.USER);
        evidenceService.addEvidence(PROJECT, child.id(), evidence("child evidence"));
        evidenceService.addEvidence(PROJECT, keep.id(), evidence("kept evidence"));

        Set<String> removed = service.delete(PROJECT, root.id(), ChangeEvent.Origin.USER).orElseThrow();

        assertThat(removed).containsExactlyInAnyOrder(root.id(), child.id());
        assertThat(evidenceService.evidenceFor(PROJECT, child.id())).isEmpty();
        assertThat(evidenceService.evidenceFor(PROJECT, keep.id())).hasSize(1);
        assertThat(service.delete(PROJECT, root.id(), ChangeEvent.Origin.USER)).isEmpty();
    }

    @Test
    void blankSearchReturnsMostRelevantPages() {
        DocumentPageDto low = service.createRoot(PROJECT, "Low", ChangeEvent.Origin.USER);
        DocumentPageDto high = service.createRoot(PROJECT, "High", ChangeEvent.Origin.USER);
        service.createRoot(PROJECT, "Unscored", ChangeEvent.Origin.USER);
        setScore(low, 20);
        setScore(high, 90);

        List<DocumentSummaryDto> results = service.searchDocuments(PROJECT, "", 2);

        assertThat(results).extracting(DocumentSummaryDto::title).containsExactly("High", "Low");
    }

    @Test
    void querySearchRanksTitleMatchesFirst() {
        DocumentPageDto body = service.createRoot(PROJECT, "Onboarding", ChangeEvent.Origin.USER);
        service.update(PROJECT, body.id(), new DocumentMetadataUpdate(null, "Covers password rotation", null,
                null, null, null, null, null, null), ChangeEvent.Origin.USER);
        service.createRoot(PROJECT, "Password Policy", ChangeEvent.Origin.USER);
        service.createRoot(PROJECT, "Backups", ChangeEvent.Origin.USER);

        List<DocumentSummaryDto> results = service.searchDocuments(PROJECT, "PASSWORD", null);

        assertThat(results).extracting(DocumentSummaryDto::title).containsExactly("Password Policy", "Onboarding");
    }

    @Test
    void mutationsPublishDocumentEvents() {
        DocumentPageDto page = service.createRoot(PROJECT, "A", ChangeEvent.Origin.ASSISTANT);
        service.delete(PROJECT, page.id(), ChangeEvent.Origin.USER);

        assertThat(events.currentSeq(PROJECT)).isEqualTo(2);
    }

    private void setScore(DocumentPageDto page, int score) {
        service.update(PROJECT, page.id(), new DocumentMetadataUpdate(null, null, null, null, null, null, null,
                score, null), ChangeEvent.Origin.USER);
    }

    private static EvidenceDto evidence(String name) {
        return new EvidenceDto(null, null, name, null, "text", new TextNode("value"), null, null);
    }

    private static EvidenceRequestDto request(String title) {
        return new EvidenceRequestDto(null, null, title, null, "pending", null, null);
    }
}
