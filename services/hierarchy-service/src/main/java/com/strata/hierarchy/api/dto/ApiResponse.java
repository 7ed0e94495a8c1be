package com.strata.hierarchy.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.strata.hierarchy.domain.PageResult;
import java.util.List;
import java.util.function.Function;

/**
 * Success envelope: {@code {"success": true, "data": ..., "meta": ...}}. {@code meta} is only
 * present on listings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, PageMeta meta) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T, R> ApiResponse<List<R>> page(PageResult<T> page, Function<T, R> mapper) {
        return new ApiResponse<>(true, page.map(mapper).items(), PageMeta.from(page));
    }
}
