package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.client.api.ClientSettings;
import io.github.drompincen.complianceboard.client.api.ComplianceApi;
import io.github.drompincen.complianceboard.client.state.DebouncedQuery;
import io.github.drompincen.complianceboard.client.state.LoadState;
import io.github.drompincen.complianceboard.protocol.api.DocumentSummaryDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Search-as-you-type over one input. An empty input is still sent: the server answers it with its default
 * top results. At most {@code limit} results are kept.
 */
public class Typeahead<T> {

    private final Function<String, CompletableFuture<List<T>>> search;
    private final DebouncedQuery<List<T>> debounce;
    private final int limit;
    private LoadState<List<T>> results = LoadState.idle();
    private String query;

    public Typeahead(Function<String, CompletableFuture<List<T>>> search, int limit,
                     ClientSettings settings, Scheduler scheduler, Executor ui) {
        this.search = search;
        this.limit = limit;
        this.debounce = new DebouncedQuery<>(scheduler, settings.debounce(), ui);
    }

    public static Typeahead<DocumentSummaryDto> documents(ComplianceApi api, String projectId,
                                                          ClientSettings settings, Scheduler scheduler, Executor ui) {
        return new Typeahead<>(q -> api.searchDocuments(projectId, q), settings.typeaheadLimit(),
                settings, scheduler, ui);
    }

    public static Typeahead<EvidenceRequestDto> evidenceRequests(ComplianceApi api, String projectId,
                                                                 ClientSettings settings, Scheduler scheduler,
                                                                 Executor ui) {
        return new Typeahead<>(q -> api.searchEvidenceRequests(projectId, q), settings.typeaheadLimit(),
                settings, scheduler, ui);
    }

    public void onInput(String text) {
        String q = text == null ? "" : text.trim();
        query = q;
        results = LoadState.loading(results.value());
        debounce.submit(q, search,
                found -> results = LoadState.loaded(cap(found)),
                error -> results = LoadState.error(error, () -> onInput(q)));
    }

    public void clear() {
        debounce.cancel();
        query = null;
        results = LoadState.idle();
    }

    public LoadState<List<T>> results() {
        return results;
    }

    public String query() {
        return query;
    }

    private List<T> cap(List<T> found) {
        if (found == null) return List.of();
        return found.size() <= limit ? List.copyOf(found) : List.copyOf(found.subList(0, limit));
    }
}
