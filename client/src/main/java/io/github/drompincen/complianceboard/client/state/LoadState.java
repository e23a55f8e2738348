package io.github.drompincen.complianceboard.client.state;

/**
 * Inline state of one panel. An error keeps the action that retries the load.
 */
public final class LoadState<T> {

    public enum Status {
        IDLE, LOADING, LOADED, ERROR
    }

    private static final LoadState<?> IDLE = new LoadState<>(Status.IDLE, null, null, null);

    private final Status status;
    private final T value;
    private final String error;
    private final Runnable retry;

    private LoadState(Status status, T value, String error, Runnable retry) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.retry = retry;
    }

    @SuppressWarnings("unchecked")
    public static <T> LoadState<T> idle() {
        return (LoadState<T>) IDLE;
    }

    /** Loading, still showing {@code previous} until the new value arrives. */
    public static <T> LoadState<T> loading(T previous) {
        return new LoadState<>(Status.LOADING, previous, null, null);
    }

    public static <T> LoadState<T> loaded(T value) {
        return new LoadState<>(Status.LOADED, value, null, null);
    }

    public static <T> LoadState<T> error(String message, Runnable retry) {
        return new LoadState<>(Status.ERROR, null, message, retry);
    }

    public Status status() { return status; }

    public T value() { return value; }

    public String error() { return error; }

    public boolean isLoading() { return status == Status.LOADING; }

    public boolean isLoaded() { return status == Status.LOADED; }

    public boolean isError() { return status == Status.ERROR; }

    public void retry() {
        if (retry != null) retry.run();
    }

    @Override
    public String toString() {
        return "LoadState[" + status + (error != null ? ", " + error : "") + "]";
    }
}
