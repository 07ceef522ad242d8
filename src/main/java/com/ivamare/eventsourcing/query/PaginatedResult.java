package com.ivamare.eventsourcing.query;

import java.util.List;

/**
 * One page of query results.
 *
 * @param items      items on this page
 * @param page       1-based page number
 * @param pageSize   requested page size
 * @param totalItems total number of items across pages
 * @param <T>        item type
 */
public record PaginatedResult<T>(
    List<T> items,
    int page,
    int pageSize,
    long totalItems
) {

    public PaginatedResult {
        validate(page, pageSize);
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Cut one page out of a full list.
     */
    public static <T> PaginatedResult<T> of(List<T> all, int page, int pageSize) {
        validate(page, pageSize);
        int from = (int) Math.min((long) (page - 1) * pageSize, all.size());
        int to = (int) Math.min((long) from + pageSize, all.size());
        return new PaginatedResult<>(all.subList(from, to), page, pageSize, all.size());
    }

    private static void validate(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }

    public int totalPages() {
        return (int) ((totalItems + pageSize - 1) / pageSize);
    }

    public boolean hasNextPage() {
        return page < totalPages();
    }

    public boolean hasPrevPage() {
        return page > 1;
    }
}
