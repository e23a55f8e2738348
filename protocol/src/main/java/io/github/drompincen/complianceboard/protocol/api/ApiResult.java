package io.github.drompincen.complianceboard.protocol.api;

public record ApiResult<T>(
        boolean success,
        T value,
        String error
) {
    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(true, value, null);
    }

    public static <T> ApiResult<T> ok() {
        return new ApiResult<>(true, null, null);
    }

    public static <T> ApiResult<T> failure(String error) {
        return new ApiResult<>(false, null, error);
    }
}
