package com.strata.hierarchy.domain;

import java.util.List;
import java.util.function.Function;

/** One page of a listing plus the total across all pages. */
public record PageResult<T>(List<T> items, int page, int perPage, long total) {

    public PageResult {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return total == 0 ? 0 : (int) ((total + perPage - 1) / perPage);
    }

    public <R> PageResult<R> map(Function<T, R> mapper) {
        return new PageResult<>(items.stream().map(mapper).toList(), page, perPage, total);
    }
}
