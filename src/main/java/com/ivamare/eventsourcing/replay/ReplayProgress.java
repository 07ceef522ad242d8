package com.ivamare.eventsourcing.replay;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a replay session's progress.
 *
 * <p>{@code processedEvents} counts every event the session went through, including
 * those whose dispatch failed; failures are listed in {@code errors}.
 */
public record ReplayProgress(
    int totalEvents,
    int processedEvents,
    Instant currentTimestamp,
    Instant startTime,
    long elapsedMs,
    long estimatedRemainingMs,
    double eventsPerSecond,
    ReplayStatus status,
    List<String> errors
) {

    public ReplayProgress {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
