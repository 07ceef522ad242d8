package com.ivamare.eventsourcing.query.impl;

import com.ivamare.eventsourcing.exception.ValidationException;
import com.ivamare.eventsourcing.handler.HandlerRegistry;
import com.ivamare.eventsourcing.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventsourcing.pipeline.MiddlewareChain;
import com.ivamare.eventsourcing.pipeline.RequestMdc;
import com.ivamare.eventsourcing.pipeline.Result;
import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryBus;
import com.ivamare.eventsourcing.query.QueryCache;
import com.ivamare.eventsourcing.query.QueryHandler;
import com.ivamare.eventsourcing.query.QueryMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Default implementation of QueryBus.
 */
public class DefaultQueryBus implements QueryBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultQueryBus.class);

    private final HandlerRegistry<QueryHandler> handlers;
    private final QueryCache cache;
    private final MiddlewareChain<Query> chain = new MiddlewareChain<>();

    public DefaultQueryBus() {
        this(new DefaultHandlerRegistry<>("query"), new QueryCache(Duration.ofSeconds(60)));
    }

    public DefaultQueryBus(QueryCache cache) {
        this(new DefaultHandlerRegistry<>("query"), cache);
    }

    public DefaultQueryBus(HandlerRegistry<QueryHandler> handlers, QueryCache cache) {
        this.handlers = handlers;
        this.cache = cache;
    }

    @Override
    public void register(String queryType, Supplier<? extends QueryHandler> handlerFactory) {
        handlers.register(queryType, handlerFactory);
        log.info("Registered query handler for {}", queryType);
    }

    @Override
    public void use(QueryMiddleware middleware) {
        chain.add(middleware);
        log.debug("Added query middleware {}", middleware.getClass().getSimpleName());
    }

    @Override
    public Result<Object> execute(Query query) {
        long start = System.nanoTime();
        String correlationId = query != null && query.correlationId() != null
            ? query.correlationId()
            : UUID.randomUUID().toString();

        RequestMdc.put(correlationId, query != null ? query.queryType() : null);
        try {
            if (query == null) {
                throw new ValidationException("Query must not be null");
            }
            String cacheKey = query.cacheKey();
            if (cacheKey != null && !query.skipCache()) {
                Optional<Object> cached = cache.get(cacheKey);
                if (cached.isPresent()) {
                    log.debug("Cache hit for {} (key={})", query.queryType(), cacheKey);
                    return Result.cached(cached.get(), correlationId, elapsedMs(start));
                }
            }

            Query withId = query.correlationId() != null ? query : query.withCorrelationId(correlationId);
            Object data = chain.execute(withId, this::invokeHandler);

            if (cacheKey != null) {
                cache.put(cacheKey, data);
            }
            return Result.success(data, correlationId, elapsedMs(start));
        } catch (Exception e) {
            log.warn("Query {} failed (correlationId={}): {}",
                query != null ? query.queryType() : null, correlationId, e.getMessage());
            return Result.failure(e, correlationId, elapsedMs(start));
        } finally {
            RequestMdc.clear();
        }
    }

    private Object invokeHandler(Query query) throws Exception {
        QueryHandler handler = handlers.getOrThrow(query.queryType());
        return handler.handle(query);
    }

    @Override
    public void invalidateCache() {
        invalidateCache(null);
    }

    @Override
    public void invalidateCache(String pattern) {
        int removed = cache.invalidate(pattern);
        log.debug("Invalidated {} cached query results (pattern={})", removed, pattern);
    }

    @Override
    public boolean hasHandler(String queryType) {
        return handlers.hasHandler(queryType);
    }

    @Override
    public List<String> registeredQueryTypes() {
        return handlers.registeredTypes();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
