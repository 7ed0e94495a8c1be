package com.strata.hierarchy.domain;

import java.util.Locale;

/**
 * Paging, sorting, search and soft-delete options for a listing.
 *
 * @param page 1-based page number
 * @param perPage page size, 1 to {@value #MAX_PER_PAGE}
 * @param sortBy column to sort by; null for the listing's default. Each listing accepts its own set
 * @param sortOrder ascending or descending
 * @param search case-insensitive substring; null or blank for no filter
 * @param includeDeleted whether soft-deleted rows are included
 */
public record ListQuery(
        int page,
        int perPage,
        String sortBy,
        SortOrder sortOrder,
        String search,
        boolean includeDeleted) {

    public static final int DEFAULT_PER_PAGE = 25;
    public static final int MAX_PER_PAGE = 100;

    public ListQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new IllegalArgumentException("per_page must be between 1 and " + MAX_PER_PAGE);
        }
        if (sortOrder == null) {
            sortOrder = SortOrder.ASC;
        }
        if (search != null && search.isBlank()) {
            search = null;
        }
    }

    public static ListQuery firstPage() {
        return new ListQuery(1, DEFAULT_PER_PAGE, null, SortOrder.ASC, null, false);
    }

    /** Rows to skip; a long so that a page far past the end does not overflow. */
    public long offset() {
        return (page - 1L) * perPage;
    }

    /** Search term wrapped for a case-insensitive {@code LIKE}, with wildcards escaped. */
    public String searchPattern() {
        if (search == null) {
            return null;
        }
        String escaped =
                search.strip()
                        .toLowerCase(Locale.ROOT)
                        .replace("\\", "\\\\")
                        .replace("%", "\\%")
                        .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    public enum SortOrder {
        ASC,
        DESC;

        /**
         * Parses {@code asc} or {@code desc}, ignoring case.
         *
         * @throws IllegalArgumentException for anything else
         */
        public static SortOrder fromValue(String value) {
            if (value == null || value.isBlank()) {
                return ASC;
            }
            return switch (value.strip().toLowerCase(Locale.ROOT)) {
                case "asc" -> ASC;
                case "desc" -> DESC;
                default -> throw new IllegalArgumentException(
                        "sort_order must be 'asc' or 'desc'");
            };
        }
    }
}
