package io.github.drompincen.complianceboard.client.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.drompincen.complianceboard.protocol.api.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpComplianceApiTest {

    private HttpServer server;
    private HttpComplianceApi api;
    private final List<String> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/projects/p1/tasks", exchange -> {
            record(exchange);
            if ("PUT".equals(exchange.getRequestMethod())) {
                respond(exchange, 400, "{\"error\":\"Resolution reason is required to complete a task\"}");
            } else {
                respond(exchange, 200, "{\"items\":[{\"id\":\"t1\",\"title\":\"Rotate keys\",\"status\":\"in-progress\","
                        + "\"priority\":\"high\",\"dueDate\":\"2026-11-01\",\"unknownField\":1}],"
                        + "\"total\":1,\"pages\":1,\"limit\":5,\"offset\":0}");
            }
        });
        server.createContext("/api/projects/p1/documents/missing/full", exchange -> {
            record(exchange);
            respond(exchange, 404, "");
        });
        server.createContext("/api/projects/p1/auditors/a1", exchange -> {
            record(exchange);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        api = new HttpComplianceApi(ClientSettings.defaults("http://127.0.0.1:" + server.getAddress().getPort() + "/"));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void emptySearchQueryIsSentExplicitly() {
        PageResult<ProjectTaskDto> page = api.listTasks("p1", TaskQuery.search("")).join();

        assertThat(requests).containsExactly("GET /api/projects/p1/tasks?q=");
        assertThat(page.items()).hasSize(1);
        ProjectTaskDto task = page.items().get(0);
        assertThat(task.status()).isEqualTo(ProjectTaskDto.TaskStatus.IN_PROGRESS);
        assertThat(task.priority()).isEqualTo(ProjectTaskDto.TaskPriority.HIGH);
    }

    @Test
    void listWithoutQueryOmitsQ() {
        api.listTasks("p1", new TaskQuery(50, 0, ProjectTaskDto.TaskStatus.STUCK, null)).join();

        assertThat(requests).containsExactly("GET /api/projects/p1/tasks?limit=50&offset=0&status=stuck");
    }

    @Test
    void refusedMutationCarriesServerError() {
        ApiResult<ProjectTaskDto> result = api.updateTask("p1", "t1",
                UpdateTaskRequest.status(ProjectTaskDto.TaskStatus.COMPLETED, null)).join();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Resolution reason is required to complete a task");
    }

    @Test
    void noContentDeleteSucceeds() {
        ApiResult<Void> result = api.deleteAuditor("p1", "a1").join();

        assertThat(result.success()).isTrue();
        assertThat(requests).containsExactly("DELETE /api/projects/p1/auditors/a1");
    }

    @Test
    void failedReadCompletesExceptionally() {
        assertThatThrownBy(() -> api.getFullDocument("p1", "missing").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ComplianceApiException.class);
    }

    private void record(HttpExchange exchange) {
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getRawPath()
                + (query != null ? "?" + query : ""));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }
}
