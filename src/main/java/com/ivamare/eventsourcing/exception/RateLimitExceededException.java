package com.ivamare.eventsourcing.exception;

import java.time.Duration;

/**
 * Raised when an actor exceeds its request ceiling for the current window.
 *
 * <p>Callers may retry once the window has rolled over.
 */
public class RateLimitExceededException extends EventSourcingException {

    private final String actorKey;
    private final long limit;
    private final Duration window;

    public RateLimitExceededException(String actorKey, long limit, Duration window) {
        super("Rate limit exceeded for " + actorKey + ": " + limit + " requests per " + window);
        this.actorKey = actorKey;
        this.limit = limit;
        this.window = window;
    }

    public String getActorKey() {
        return actorKey;
    }

    public long getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
