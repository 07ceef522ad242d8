package com.ivamare.eventsourcing.query.middleware;

import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryMiddleware;

/**
 * Applies default paging and clamps the page size.
 */
public class PaginationMiddleware implements QueryMiddleware {

    private final int defaultPageSize;
    private final int maxPageSize;

    public PaginationMiddleware(int defaultPageSize, int maxPageSize) {
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("Require 1 <= defaultPageSize <= maxPageSize");
        }
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    @Override
    public Object handle(Query query, Next next) throws Exception {
        if (query.getPage() == null || query.getPage() < 1) {
            query.setPage(1);
        }
        if (query.getPageSize() == null || query.getPageSize() < 1) {
            query.setPageSize(defaultPageSize);
        }
        if (query.getPageSize() > maxPageSize) {
            query.setPageSize(maxPageSize);
        }
        return next.proceed();
    }
}
