package io.github.drompincen.complianceboard.client.api;

import io.github.drompincen.complianceboard.protocol.api.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous view of the gateway, scoped per project.
 * <p>
 * Reads complete exceptionally with {@link ComplianceApiException} when the server refuses them. Mutations
 * always complete normally with an {@link ApiResult}; a refused mutation carries the server's error message.
 */
public interface ComplianceApi {

    // ---- Auditors ----

    CompletableFuture<PageResult<AuditorDto>> listAuditors(String projectId, int limit, int offset);

    CompletableFuture<AuditorDto> getAuditor(String projectId, String auditorId);

    CompletableFuture<ApiResult<AuditorDto>> createAuditor(String projectId, AuditorRequest request);

    CompletableFuture<ApiResult<AuditorDto>> updateAuditor(String projectId, String auditorId, AuditorRequest request);

    CompletableFuture<ApiResult<Void>> deleteAuditor(String projectId, String auditorId);

    /** Starts a run and returns the running report; does not wait for the run to finish. */
    CompletableFuture<ApiResult<AuditReportDto>> runAuditor(String projectId, String auditorId);

    CompletableFuture<PageResult<AuditReportDto>> listAuditReports(String projectId, String auditorId,
                                                                   int limit, int offset);

    // ---- Documents ----

    CompletableFuture<List<DocumentPageDto>> getDocumentTree(String projectId);

    CompletableFuture<FullDocumentDto> getFullDocument(String projectId, String pageId);

    CompletableFuture<List<AuditorDto>> getDocumentAuditors(String projectId, String pageId);

    CompletableFuture<ApiResult<DocumentPageDto>> createPage(String projectId, CreatePageRequest request);

    CompletableFuture<ApiResult<DocumentPageDto>> updatePage(String projectId, String pageId,
                                                             DocumentMetadataUpdate update);

    CompletableFuture<ApiResult<Void>> deletePage(String projectId, String pageId);

    CompletableFuture<List<DocumentSummaryDto>> searchDocuments(String projectId, String q);

    CompletableFuture<List<EvidenceRequestDto>> searchEvidenceRequests(String projectId, String q);

    // ---- Tasks ----

    CompletableFuture<PageResult<ProjectTaskDto>> listTasks(String projectId, TaskQuery query);

    CompletableFuture<ApiResult<ProjectTaskDto>> createTask(String projectId, CreateTaskRequest request);

    CompletableFuture<ApiResult<ProjectTaskDto>> updateTask(String projectId, String taskId, UpdateTaskRequest request);

    CompletableFuture<ApiResult<Void>> deleteTask(String projectId, String taskId);
}
