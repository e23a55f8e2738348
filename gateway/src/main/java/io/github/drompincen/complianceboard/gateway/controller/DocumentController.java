package io.github.drompincen.complianceboard.gateway.controller;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.document.DocumentService;
import io.github.drompincen.complianceboard.runtime.related.RelatedPageClassifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/documents")
public class DocumentController {

    private final DocumentService documentService;

    public DocumentController(DocumentService documentService) {
        this.documentService = documentService;
    }

    @GetMapping({"", "/tree"})
    public List<DocumentPageDto> tree(@PathVariable String projectId) {
        return documentService.getDocumentTree(projectId);
    }

    @PostMapping
    public ResponseEntity<DocumentPageDto> create(@PathVariable String projectId,
                                                  @RequestBody(required = false) CreatePageRequest body) {
        String title = body != null ? body.title() : null;
        if (body != null && body.parentId() != null) {
            return documentService.addChild(projectId, body.parentId(), title, ChangeEvent.Origin.USER)
                    .map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        }
        return ResponseEntity.ok(documentService.createRoot(projectId, title, ChangeEvent.Origin.USER));
    }

    @GetMapping("/search")
    public List<DocumentSummaryDto> search(@PathVariable String projectId,
                                           @RequestParam(required = false) String q,
                                           @RequestParam(required = false) Integer limit) {
        return documentService.searchDocuments(projectId, q, limit);
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentPageDto> get(@PathVariable String projectId, @PathVariable String documentId) {
        return documentService.find(projectId, documentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{documentId}/full")
    public ResponseEntity<FullDocumentDto> full(@PathVariable String projectId, @PathVariable String documentId) {
        return documentService.getFullDocument(projectId, documentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{documentId}/children")
    public ResponseEntity<DocumentPageDto> addChild(@PathVariable String projectId, @PathVariable String documentId,
                                                    @RequestBody(required = false) CreatePageRequest body) {
        return documentService.addChild(projectId, documentId, body != null ? body.title() : null,
                        ChangeEvent.Origin.USER)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{documentId}")
    public ResponseEntity<DocumentPageDto> update(@PathVariable String projectId, @PathVariable String documentId,
                                                  @RequestBody DocumentMetadataUpdate update) {
        return documentService.update(projectId, documentId, update, ChangeEvent.Origin.USER)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable String documentId) {
        return documentService.delete(projectId, documentId, ChangeEvent.Origin.USER).isPresent()
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/{documentId}/relations")
    public ResponseEntity<?> relate(@PathVariable String projectId, @PathVariable String documentId,
                                    @RequestBody RelationRequest request) {
        return ApiResponses.of(documentService.relate(projectId, documentId, request), "Document not found");
    }

    @GetMapping("/{documentId}/relations")
    public ResponseEntity<RelatedPageSummary.Groups> relations(@PathVariable String projectId,
                                                              @PathVariable String documentId) {
        if (!documentService.exists(projectId, documentId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(RelatedPageClassifier.partition(documentService.relatedPages(projectId, documentId)));
    }
}
