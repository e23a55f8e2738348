package io.github.drompincen.complianceboard.client.state;

import io.github.drompincen.complianceboard.client.api.ApiCalls;
import io.github.drompincen.complianceboard.protocol.api.ApiResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A local change applied ahead of its remote call. The state is captured when the mutation is created; when
 * the call fails the captured snapshot is written back as a whole, never merged field by field.
 *
 * @param <S> the state being mutated, treated as an immutable value
 */
public class OptimisticMutation<S> {

    private final S snapshot;
    private final Consumer<S> restore;
    private final Runnable change;

    public OptimisticMutation(Supplier<S> capture, Consumer<S> restore, Runnable change) {
        this.snapshot = capture.get();
        this.restore = restore;
        this.change = change;
    }

    public S snapshot() {
        return snapshot;
    }

    public void apply() {
        change.run();
    }

    public void rollback() {
        restore.accept(snapshot);
    }

    /**
     * Applies the change, runs {@code call} and rolls back on the {@code ui} executor when it fails. The
     * returned future never completes exceptionally.
     */
    public <R> CompletableFuture<ApiResult<R>> execute(Supplier<CompletableFuture<ApiResult<R>>> call,
                                                       Executor ui, String action) {
        apply();
        return ApiCalls.guard(call, action).thenApplyAsync(result -> {
            if (!result.success()) rollback();
            return result;
        }, ui);
    }
}
