package com.ivamare.eventsourcing.query.middleware;

import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flags queries slower than a threshold.
 */
public class PerformanceTrackingMiddleware implements QueryMiddleware {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTrackingMiddleware.class);

    private final long thresholdMs;
    private final AtomicLong slowQueries = new AtomicLong();

    public PerformanceTrackingMiddleware(Duration slowQueryThreshold) {
        this.thresholdMs = slowQueryThreshold.toMillis();
    }

    @Override
    public Object handle(Query query, Next next) throws Exception {
        long start = System.currentTimeMillis();
        Object result = next.proceed();
        long duration = System.currentTimeMillis() - start;
        if (duration > thresholdMs) {
            slowQueries.incrementAndGet();
            log.warn("Slow query detected: {} took {}ms", query.queryType(), duration);
        }
        return result;
    }

    public long getSlowQueryCount() {
        return slowQueries.get();
    }
}
