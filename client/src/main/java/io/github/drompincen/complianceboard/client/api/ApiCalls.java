package io.github.drompincen.complianceboard.client.api;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/** Keeps exceptions from crossing a model boundary: every mutation settles as an {@link ApiResult}. */
public final class ApiCalls {

    private static final Logger log = LoggerFactory.getLogger(ApiCalls.class);

    private ApiCalls() {}

    public static <T> CompletableFuture<ApiResult<T>> guard(Supplier<CompletableFuture<ApiResult<T>>> call,
                                                             String action) {
        CompletableFuture<ApiResult<T>> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            log.warn("Could not {}", action, e);
            return CompletableFuture.completedFuture(ApiResult.failure(fallback(action)));
        }
        return future.handle((result, error) -> {
            if (error != null || result == null) {
                if (error != null) log.warn("Could not {}: {}", action, error.getMessage());
                return ApiResult.failure(fallback(action));
            }
            if (!result.success() && (result.error() == null || result.error().isBlank())) {
                return ApiResult.failure(fallback(action));
            }
            return result;
        });
    }

    /** Message of a failed read, or the generic fallback when it has none. */
    public static String message(Throwable error, String action) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ComplianceApiException && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            return cause.getMessage();
        }
        return fallback(action);
    }

    public static String fallback(String action) {
        return "Failed to " + action;
    }
}
