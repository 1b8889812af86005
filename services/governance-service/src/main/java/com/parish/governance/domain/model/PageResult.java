package com.parish.governance.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * @param items page content
 * @param page  one-based page number
 * @param limit page size
 * @param total total number of matching items
 */
public record PageResult<T>(List<T> items, int page, int limit, long total) {

    public PageResult {
        items = List.copyOf(items);
    }

    public static <T> PageResult<T> of(List<T> items, PageRequest request, long total) {
        return new PageResult<>(items, request.page(), request.limit(), total);
    }

    public <R> PageResult<R> map(Function<T, R> mapper) {
        return new PageResult<>(items.stream().map(mapper).toList(), page, limit, total);
    }
}
