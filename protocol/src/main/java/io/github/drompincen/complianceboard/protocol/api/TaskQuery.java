package io.github.drompincen.complianceboard.protocol.api;

/**
 * Task list query. {@code q == null} means "no search"; an empty {@code q} asks for the bounded default set.
 */
public record TaskQuery(
        Integer limit,
        Integer offset,
        ProjectTaskDto.TaskStatus status,
        String q
) {
    public static TaskQuery page(int limit, int offset) {
        return new TaskQuery(limit, offset, null, null);
    }

    public static TaskQuery search(String q) {
        return new TaskQuery(null, null, null, q == null ? "" : q);
    }

    public boolean hasQuery() {
        return q != null;
    }
}
