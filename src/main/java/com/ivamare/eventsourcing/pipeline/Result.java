package com.ivamare.eventsourcing.pipeline;

import java.time.Instant;

/**
 * Uniform outcome envelope returned by the command and query buses.
 *
 * @param success         whether the handler completed
 * @param data            handler result on success
 * @param error           human-readable error on failure
 * @param errorType       simple name of the failure exception
 * @param timestamp       completion time
 * @param correlationId   request correlation id
 * @param fromCache       true when served from the query cache
 * @param executionTimeMs pipeline execution time
 * @param <T>             data type
 */
public record Result<T>(
    boolean success,
    T data,
    String error,
    String errorType,
    Instant timestamp,
    String correlationId,
    boolean fromCache,
    long executionTimeMs
) {

    public static <T> Result<T> success(T data, String correlationId, long executionTimeMs) {
        return new Result<>(true, data, null, null, Instant.now(), correlationId, false, executionTimeMs);
    }

    public static <T> Result<T> cached(T data, String correlationId, long executionTimeMs) {
        return new Result<>(true, data, null, null, Instant.now(), correlationId, true, executionTimeMs);
    }

    public static <T> Result<T> failure(Exception exception, String correlationId, long executionTimeMs) {
        String message = exception.getMessage() != null
            ? exception.getMessage()
            : exception.getClass().getSimpleName();
        return new Result<>(false, null, message, exception.getClass().getSimpleName(),
            Instant.now(), correlationId, false, executionTimeMs);
    }

    public boolean isFailure() {
        return !success;
    }
}
