package io.github.drompincen.complianceboard.gateway.controller;

import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceEntry;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceTimeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}")
public class EvidenceController {

    private final DocumentService documentService;
    private final EvidenceService evidenceService;

    public EvidenceController(DocumentService documentService, EvidenceService evidenceService) {
        this.documentService = documentService;
        this.evidenceService = evidenceService;
    }

    @PostMapping("/documents/{documentId}/evidence")
    public ResponseEntity<?> addEvidence(@PathVariable String projectId, @PathVariable String documentId,
                                         @RequestBody EvidenceDto body) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ApiResponses.of(evidenceService.addEvidence(projectId, documentId, body));
    }

    @GetMapping("/documents/{documentId}/evidence")
    public ResponseEntity<List<EvidenceDto>> evidence(@PathVariable String projectId, @PathVariable String documentId) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(evidenceService.evidenceFor(projectId, documentId));
    }

    @PostMapping("/documents/{documentId}/evidence-requests")
    public ResponseEntity<?> addRequest(@PathVariable String projectId, @PathVariable String documentId,
                                        @RequestBody EvidenceRequestDto body) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ApiResponses.of(evidenceService.addRequest(projectId, documentId, body));
    }

    @GetMapping("/documents/{documentId}/evidence-requests")
    public ResponseEntity<List<EvidenceRequestDto>> requests(@PathVariable String projectId,
                                                             @PathVariable String documentId) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(evidenceService.requestsFor(projectId, documentId));
    }

    /** Requests first, then collected evidence. */
    @GetMapping("/documents/{documentId}/evidence-timeline")
    public ResponseEntity<List<EvidenceEntry>> timeline(@PathVariable String projectId,
                                                        @PathVariable String documentId) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(EvidenceTimeline.combine(evidenceService.evidenceFor(projectId, documentId),
                evidenceService.requestsFor(projectId, documentId)));
    }

    @GetMapping("/evidence-requests")
    public List<EvidenceRequestDto> searchOpen(@PathVariable String projectId,
                                               @RequestParam(required = false) String q,
                                               @RequestParam(defaultValue = "10") int limit) {
        return evidenceService.searchOpenRequests(projectId, q, limit);
    }
}
