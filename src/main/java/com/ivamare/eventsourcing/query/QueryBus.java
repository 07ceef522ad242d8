package com.ivamare.eventsourcing.query;

import com.ivamare.eventsourcing.pipeline.Result;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for read requests, with a result cache in front of the pipeline.
 */
public interface QueryBus {

    void register(String queryType, Supplier<? extends QueryHandler> handlerFactory);

    /**
     * Append a middleware. Registration order is execution order, outermost first.
     */
    void use(QueryMiddleware middleware);

    /**
     * Execute a query. Never throws.
     *
     * <p>When the query has a cache key and does not skip the cache, a live cached value
     * is returned with {@code fromCache=true} without running the pipeline. Otherwise
     * the pipeline runs and a non-null result is cached under the key.
     */
    Result<Object> execute(Query query);

    /**
     * Clear every cached result.
     */
    void invalidateCache();

    /**
     * Clear cached results whose key contains {@code pattern}; null clears everything.
     */
    void invalidateCache(String pattern);

    boolean hasHandler(String queryType);

    List<String> registeredQueryTypes();
}
