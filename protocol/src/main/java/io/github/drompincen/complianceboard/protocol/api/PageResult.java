package io.github.drompincen.complianceboard.protocol.api;

import java.util.List;

public record PageResult<T>(
        List<T> items,
        long total,
        int pages,
        int limit,
        int offset
) {
    public static <T> PageResult<T> of(List<T> items, long total, int limit, int offset) {
        int pages = limit > 0 ? (int) ((total + limit - 1) / limit) : 0;
        return new PageResult<>(items, total, pages, limit, offset);
    }

    public static <T> PageResult<T> empty(int limit, int offset) {
        return of(List.of(), 0, limit, offset);
    }
}
