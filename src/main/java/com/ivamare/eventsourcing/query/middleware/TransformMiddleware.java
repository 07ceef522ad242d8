package com.ivamare.eventsourcing.query.middleware;

import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryMiddleware;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Post-processes handler results with a per-query-type function.
 */
public class TransformMiddleware implements QueryMiddleware {

    private final Map<String, UnaryOperator<Object>> transformers = new ConcurrentHashMap<>();

    public TransformMiddleware registerTransformer(String queryType, UnaryOperator<Object> transformer) {
        transformers.put(queryType, transformer);
        return this;
    }

    @Override
    public Object handle(Query query, Next next) throws Exception {
        Object result = next.proceed();
        UnaryOperator<Object> transformer = transformers.get(query.queryType());
        return transformer != null ? transformer.apply(result) : result;
    }
}
