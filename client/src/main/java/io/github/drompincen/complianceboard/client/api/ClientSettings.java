package io.github.drompincen.complianceboard.client.api;

import java.net.URI;
import java.time.Duration;

/**
 * @param baseUrl        gateway root, e.g. {@code http://localhost:8080}
 * @param requestTimeout per-request timeout
 * @param debounce       quiet period before a typeahead query is sent
 * @param typeaheadLimit results shown by a typeahead
 * @param pageSize       page size of the auditor list
 */
public record ClientSettings(
        URI baseUrl,
        Duration requestTimeout,
        Duration debounce,
        int typeaheadLimit,
        int pageSize
) {
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(300);
    public static final int DEFAULT_TYPEAHEAD_LIMIT = 5;

    public static ClientSettings defaults(String baseUrl) {
        return new ClientSettings(URI.create(baseUrl), Duration.ofSeconds(30), DEFAULT_DEBOUNCE,
                DEFAULT_TYPEAHEAD_LIMIT, 10);
    }

    public ClientSettings withDebounce(Duration debounce) {
        return new ClientSettings(baseUrl, requestTimeout, debounce, typeaheadLimit, pageSize);
    }
}
