package io.github.drompincen.complianceboard.client.state;

import io.github.drompincen.complianceboard.client.api.ApiCalls;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Debounce for one input channel. A new {@link #submit} cancels the pending timer of the previous one, and a
 * response that arrives after a newer submit is discarded, even when its request was already on the wire.
 *
 * @param <T> result type of the search
 */
public class DebouncedQuery<T> {

    private final Scheduler scheduler;
    private final Duration delay;
    private final Executor ui;
    private final StaleResponseGuard guard = new StaleResponseGuard();
    private Disposable pending;

    public DebouncedQuery(Scheduler scheduler, Duration delay, Executor ui) {
        this.scheduler = scheduler;
        this.delay = delay;
        this.ui = ui;
    }

    public synchronized void submit(String query, Function<String, CompletableFuture<T>> search,
                                    Consumer<T> onResult, Consumer<String> onError) {
        if (pending != null) pending.dispose();
        long token = guard.next();
        pending = scheduler.schedule(() -> fire(token, query, search, onResult, onError),
                delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Drops the pending timer and any response still in flight. */
    public synchronized void cancel() {
        if (pending != null) pending.dispose();
        pending = null;
        guard.invalidate();
    }

    private void fire(long token, String query, Function<String, CompletableFuture<T>> search,
                      Consumer<T> onResult, Consumer<String> onError) {
        if (!guard.isCurrent(token)) return;
        CompletableFuture<T> future;
        try {
            future = search.apply(query);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenCompleteAsync((result, error) -> {
            if (!guard.isCurrent(token)) return;
            if (error != null) onError.accept(ApiCalls.message(error, "search"));
            else onResult.accept(result);
        }, ui);
    }
}
