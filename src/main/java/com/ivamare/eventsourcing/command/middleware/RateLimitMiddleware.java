package com.ivamare.eventsourcing.command.middleware;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import com.ivamare.eventsourcing.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-actor fixed-window rate limit backed by local Bucket4j buckets.
 *
 * <p>Each actor gets {@code limit} tokens, refilled all at once every {@code window}.
 * Commands without an actor share the {@value #ANONYMOUS} bucket. Counters are
 * process-local.
 */
public class RateLimitMiddleware implements CommandMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMiddleware.class);

    static final String ANONYMOUS = "anonymous";

    private final long limit;
    private final Duration window;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitMiddleware(long limit, Duration window) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        this.limit = limit;
        this.window = window;
    }

    @Override
    public Object handle(Command command, Next next) throws Exception {
        String key = command.metadata().hasActor() ? command.metadata().actorId() : ANONYMOUS;
        Bucket bucket = buckets.computeIfAbsent(key, k -> newBucket());
        if (!bucket.tryConsume(1)) {
            log.warn("Rate limit exceeded for {} on command {}", key, command.type());
            throw new RateLimitExceededException(key, limit, window);
        }
        return next.proceed();
    }

    /**
     * Tokens left in the actor's current window.
     */
    public long getAvailableTokens(String actorId) {
        Bucket bucket = buckets.get(actorId);
        return bucket == null ? limit : bucket.getAvailableTokens();
    }

    private Bucket newBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(limit)
                .refillIntervally(limit, window)
                .build())
            .build();
    }
}
