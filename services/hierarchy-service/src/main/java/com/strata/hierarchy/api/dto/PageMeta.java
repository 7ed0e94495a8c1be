package com.strata.hierarchy.api.dto;

import com.strata.hierarchy.domain.PageResult;

public record PageMeta(int page, int perPage, long total, int totalPages) {

    public static PageMeta from(PageResult<?> page) {
        return new PageMeta(page.page(), page.perPage(), page.total(), page.totalPages());
    }
}
