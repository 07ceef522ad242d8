package com.ivamare.eventsourcing.command.middleware;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.exception.RateLimitExceededException;
import com.ivamare.eventsourcing.exception.UnauthorizedException;
import com.ivamare.eventsourcing.exception.ValidationException;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Re-invokes the downstream pipeline with linearly increasing backoff.
 *
 * <p>Concurrency conflicts, validation, authorization, rate-limit and missing-handler
 * failures are rethrown immediately. Other failures are retried until the policy is
 * exhausted, then the last one is rethrown.
 */
public class RetryMiddleware implements CommandMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private static final List<Class<? extends Exception>> NON_RETRYABLE = List.of(
        ConcurrencyConflictException.class,
        ValidationException.class,
        HandlerNotFoundException.class,
        UnauthorizedException.class,
        RateLimitExceededException.class
    );

    private final RetryPolicy retryPolicy;

    public RetryMiddleware(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Object handle(Command command, Next next) throws Exception {
        int attempt = 1;
        while (true) {
            try {
                return next.proceed();
            } catch (Exception e) {
                if (!isRetryable(e) || !retryPolicy.shouldRetry(attempt)) {
                    throw e;
                }
                Duration backoff = retryPolicy.getBackoff(attempt);
                log.warn("Command {} attempt {}/{} failed, retrying in {}ms: {}",
                    command.type(), attempt, retryPolicy.maxAttempts(), backoff.toMillis(), e.getMessage());
                if (!sleep(backoff)) {
                    throw e;
                }
                attempt++;
            }
        }
    }

    static boolean isRetryable(Exception e) {
        return NON_RETRYABLE.stream().noneMatch(type -> type.isInstance(e));
    }

    private boolean sleep(Duration backoff) {
        if (backoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
