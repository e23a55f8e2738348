package io.github.drompincen.complianceboard.gateway.controller;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.runtime.auditor.AuditRunService;
import io.github.drompincen.complianceboard.runtime.auditor.AuditorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}")
public class AuditorController {

    private final AuditorService auditorService;
    private final AuditRunService auditRunService;

    public AuditorController(AuditorService auditorService, AuditRunService auditRunService) {
        this.auditorService = auditorService;
        this.auditRunService = auditRunService;
    }

    @GetMapping("/auditors")
    public PageResult<AuditorDto> list(@PathVariable String projectId,
                                       @RequestParam(defaultValue = "20") int limit,
                                       @RequestParam(defaultValue = "0") int offset) {
        return auditorService.list(projectId, limit, offset);
    }

    @PostMapping("/auditors")
    public ResponseEntity<?> create(@PathVariable String projectId, @RequestBody AuditorRequest request) {
        return ApiResponses.of(auditorService.create(projectId, request));
    }

    @GetMapping("/auditors/{auditorId}")
    public ResponseEntity<AuditorDto> get(@PathVariable String projectId, @PathVariable String auditorId) {
        return auditorService.get(projectId, auditorId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/auditors/{auditorId}")
    public ResponseEntity<?> update(@PathVariable String projectId, @PathVariable String auditorId,
                                    @RequestBody AuditorRequest request) {
        return ApiResponses.of(auditorService.update(projectId, auditorId, request), AuditorService.NOT_FOUND);
    }

    @DeleteMapping("/auditors/{auditorId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable String auditorId) {
        return auditorService.delete(projectId, auditorId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/auditors/{auditorId}/run")
    public ResponseEntity<?> run(@PathVariable String projectId, @PathVariable String auditorId) {
        return ApiResponses.of(auditRunService.run(projectId, auditorId, AuditReportDto.Trigger.MANUAL),
                AuditorService.NOT_FOUND);
    }

    @GetMapping("/auditors/{auditorId}/reports")
    public ResponseEntity<PageResult<AuditReportDto>> reports(@PathVariable String projectId,
                                                              @PathVariable String auditorId,
                                                              @RequestParam(defaultValue = "10") int limit,
                                                              @RequestParam(defaultValue = "0") int offset) {
        if (auditorService.get(projectId, auditorId).isEmpty()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(auditorService.reports(projectId, auditorId, limit, offset));
    }

    @GetMapping("/auditors/{auditorId}/reports/{reportId}")
    public ResponseEntity<AuditReportDto> report(@PathVariable String projectId, @PathVariable String auditorId,
                                                 @PathVariable String reportId) {
        if (auditorService.get(projectId, auditorId).isEmpty()) return ResponseEntity.notFound().build();
        return auditorService.findReport(auditorId, reportId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/auditors/reports/{reportId}/complete")
    public ResponseEntity<?> complete(@PathVariable String projectId, @PathVariable String reportId,
                                      @RequestBody List<RequirementOutcome> outcomes) {
        return ApiResponses.of(auditRunService.completeRun(projectId, reportId, outcomes), "Report not found");
    }

    @GetMapping("/documents/{documentId}/auditors")
    public List<AuditorDto> forDocument(@PathVariable String projectId, @PathVariable String documentId) {
        return auditorService.listForDocument(projectId, documentId);
    }
}
