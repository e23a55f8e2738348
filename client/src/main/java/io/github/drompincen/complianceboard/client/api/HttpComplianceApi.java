package io.github.drompincen.complianceboard.client.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.complianceboard.protocol.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** {@link ComplianceApi} over the gateway's REST endpoints. */
public class HttpComplianceApi implements ComplianceApi {

    private static final Logger log = LoggerFactory.getLogger(HttpComplianceApi.class);

    static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<PageResult<AuditorDto>> AUDITOR_PAGE = new TypeReference<>() {};
    private static final TypeReference<PageResult<AuditReportDto>> REPORT_PAGE = new TypeReference<>() {};
    private static final TypeReference<PageResult<ProjectTaskDto>> TASK_PAGE = new TypeReference<>() {};
    private static final TypeReference<List<AuditorDto>> AUDITORS = new TypeReference<>() {};
    private static final TypeReference<List<DocumentPageDto>> PAGES = new TypeReference<>() {};
    private static final TypeReference<List<DocumentSummaryDto>> SUMMARIES = new TypeReference<>() {};
    private static final TypeReference<List<EvidenceRequestDto>> REQUESTS = new TypeReference<>() {};

    private final HttpClient client;
    private final ClientSettings settings;

    public HttpComplianceApi(ClientSettings settings) {
        this(HttpClient.newBuilder().connectTimeout(settings.requestTimeout()).build(), settings);
    }

    public HttpComplianceApi(HttpClient client, ClientSettings settings) {
        this.client = client;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<PageResult<AuditorDto>> listAuditors(String projectId, int limit, int offset) {
        return get(project(projectId) + "/auditors?limit=" + limit + "&offset=" + offset, AUDITOR_PAGE);
    }

    @Override
    public CompletableFuture<AuditorDto> getAuditor(String projectId, String auditorId) {
        return get(project(projectId) + "/auditors/" + encode(auditorId), new TypeReference<>() {});
    }

    @Override
    public CompletableFuture<ApiResult<AuditorDto>> createAuditor(String projectId, AuditorRequest request) {
        return send("POST", project(projectId) + "/auditors", request, AuditorDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<AuditorDto>> updateAuditor(String projectId, String auditorId,
                                                                  AuditorRequest request) {
        return send("PUT", project(projectId) + "/auditors/" + encode(auditorId), request, AuditorDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<Void>> deleteAuditor(String projectId, String auditorId) {
        return send("DELETE", project(projectId) + "/auditors/" + encode(auditorId), null, Void.class);
    }

    @Override
    public CompletableFuture<ApiResult<AuditReportDto>> runAuditor(String projectId, String auditorId) {
        return send("POST", project(projectId) + "/auditors/" + encode(auditorId) + "/run", null,
                AuditReportDto.class);
    }

    @Override
    public CompletableFuture<PageResult<AuditReportDto>> listAuditReports(String projectId, String auditorId,
                                                                          int limit, int offset) {
        return get(project(projectId) + "/auditors/" + encode(auditorId) + "/reports?limit=" + limit
                + "&offset=" + offset, REPORT_PAGE);
    }

    @Override
    public CompletableFuture<List<DocumentPageDto>> getDocumentTree(String projectId) {
        return get(project(projectId) + "/documents/tree", PAGES);
    }

    @Override
    public CompletableFuture<FullDocumentDto> getFullDocument(String projectId, String pageId) {
        return get(project(projectId) + "/documents/" + encode(pageId) + "/full", new TypeReference<>() {});
    }

    @Override
    public CompletableFuture<List<AuditorDto>> getDocumentAuditors(String projectId, String pageId) {
        return get(project(projectId) + "/documents/" + encode(pageId) + "/auditors", AUDITORS);
    }

    @Override
    public CompletableFuture<ApiResult<DocumentPageDto>> createPage(String projectId, CreatePageRequest request) {
        return send("POST", project(projectId) + "/documents", request, DocumentPageDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<DocumentPageDto>> updatePage(String projectId, String pageId,
                                                                    DocumentMetadataUpdate update) {
        return send("PATCH", project(projectId) + "/documents/" + encode(pageId), update, DocumentPageDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<Void>> deletePage(String projectId, String pageId) {
        return send("DELETE", project(projectId) + "/documents/" + encode(pageId), null, Void.class);
    }

    @Override
    public CompletableFuture<List<DocumentSummaryDto>> searchDocuments(String projectId, String q) {
        return get(project(projectId) + "/documents/search?q=" + encode(q == null ? "" : q), SUMMARIES);
    }

    @Override
    public CompletableFuture<List<EvidenceRequestDto>> searchEvidenceRequests(String projectId, String q) {
        return get(project(projectId) + "/evidence-requests?q=" + encode(q == null ? "" : q), REQUESTS);
    }

    @Override
    public CompletableFuture<PageResult<ProjectTaskDto>> listTasks(String projectId, TaskQuery query) {
        StringBuilder path = new StringBuilder(project(projectId)).append("/tasks?");
        if (query.limit() != null) path.append("limit=").append(query.limit()).append('&');
        if (query.offset() != null) path.append("offset=").append(query.offset()).append('&');
        if (query.status() != null) path.append("status=").append(query.status().wire()).append('&');
        // An empty q is sent on purpose: it asks for the bounded default set.
        if (query.hasQuery()) path.append("q=").append(encode(query.q())).append('&');
        path.setLength(path.length() - 1);
        return get(path.toString(), TASK_PAGE);
    }

    @Override
    public CompletableFuture<ApiResult<ProjectTaskDto>> createTask(String projectId, CreateTaskRequest request) {
        return send("POST", project(projectId) + "/tasks", request, ProjectTaskDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<ProjectTaskDto>> updateTask(String projectId, String taskId,
                                                                   UpdateTaskRequest request) {
        return send("PUT", project(projectId) + "/tasks/" + encode(taskId), request, ProjectTaskDto.class);
    }

    @Override
    public CompletableFuture<ApiResult<Void>> deleteTask(String projectId, String taskId) {
        return send("DELETE", project(projectId) + "/tasks/" + encode(taskId), null, Void.class);
    }

    // ---- Transport ----

    private <T> CompletableFuture<T> get(String path, TypeReference<T> type) {
        HttpRequest request = request(path).GET().build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (!isSuccess(response.statusCode())) {
                        throw new ComplianceApiException(response.statusCode(), errorMessage(response));
                    }
                    try {
                        return MAPPER.readValue(response.body(), type);
                    } catch (Exception e) {
                        throw new IllegalStateException("Malformed response from " + path, e);
                    }
                });
    }

    private <T> CompletableFuture<ApiResult<T>> send(String method, String path, Object body, Class<T> type) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        HttpRequest request = request(path)
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (!isSuccess(response.statusCode())) {
                        log.debug("{} {} returned {}", method, path, response.statusCode());
                        return ApiResult.<T>failure(errorMessage(response));
                    }
                    if (type == Void.class || response.body() == null || response.body().isBlank()) {
                        return ApiResult.<T>success(null);
                    }
                    try {
                        return ApiResult.success(MAPPER.readValue(response.body(), type));
                    } catch (Exception e) {
                        throw new IllegalStateException("Malformed response from " + path, e);
                    }
                });
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl().toString().replaceAll("/+$", "") + path))
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json");
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /** The gateway's {@code {"error": "..."}} body, or null when there is none. */
    private static String errorMessage(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = MAPPER.readTree(body);
            JsonNode error = node.path("error");
            return error.isTextual() ? error.asText() : null;
        } catch (Exception e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String project(String projectId) {
        return "/api/projects/" + encode(projectId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
