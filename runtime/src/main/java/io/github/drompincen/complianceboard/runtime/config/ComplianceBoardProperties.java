package io.github.drompincen.complianceboard.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties bound from the {@code complianceboard.*} namespace.
 */
@ConfigurationProperties(prefix = "complianceboard")
public record ComplianceBoardProperties(
        Tasks tasks,
        Auditors auditors,
        Documents documents,
        Websocket websocket
) {

    public ComplianceBoardProperties {
        tasks = tasks != null ? tasks : new Tasks(0, 0, 0);
        auditors = auditors != null ? auditors : new Auditors(0, null);
        documents = documents != null ? documents : new Documents(0);
        websocket = websocket != null ? websocket : new Websocket(null, null);
    }

    public static ComplianceBoardProperties defaults() {
        return new ComplianceBoardProperties(null, null, null, null);
    }

    /**
     * @param defaultPageSize   page size used when a list request carries no limit
     * @param maxPageSize       upper bound applied to any requested limit
     * @param searchResultLimit number of tasks returned when a query is present
     */
    public record Tasks(int defaultPageSize, int maxPageSize, int searchResultLimit) {
        public Tasks {
            if (defaultPageSize <= 0) defaultPageSize = 50;
            if (maxPageSize <= 0) maxPageSize = 500;
            if (searchResultLimit <= 0) searchResultLimit = 5;
        }
    }

    /**
     * @param schedulerIntervalMs how often due auditors are looked for
     * @param timezone            zone cron schedules are evaluated in
     */
    public record Auditors(long schedulerIntervalMs, String timezone) {
        public Auditors {
            if (schedulerIntervalMs <= 0) schedulerIntervalMs = 60000;
            if (timezone == null || timezone.isBlank()) timezone = "UTC";
        }
    }

    /**
     * @param searchDefaultLimit number of pages returned by a document search
     */
    public record Documents(int searchDefaultLimit) {
        public Documents {
            if (searchDefaultLimit <= 0) searchDefaultLimit = 10;
        }
    }

    /**
     * @param path           endpoint of the project change feed
     * @param allowedOrigins origin patterns accepted on the handshake
     */
    public record Websocket(String path, List<String> allowedOrigins) {
        public Websocket {
            if (path == null || path.isBlank()) path = "/ws";
            allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : List.copyOf(allowedOrigins);
        }
    }
}
