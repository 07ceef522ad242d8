package com.ivamare.eventsourcing.replay;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one replay session. Written by the replay thread, read by callers.
 */
public class ReplaySession {

    private final String sessionId;
    private final ReplayOptions options;
    private final int totalEvents;
    private final Instant startTime;
    private final long startMillis;
    private final List<String> errors = new ArrayList<>();

    private int processedEvents;
    private Instant currentTimestamp;
    private long elapsedMs;
    private long estimatedRemainingMs;
    private double eventsPerSecond;
    private ReplayStatus status = ReplayStatus.RUNNING;

    private volatile boolean pauseRequested;
    private volatile boolean stopRequested;

    ReplaySession(String sessionId, ReplayOptions options, int totalEvents) {
        this.sessionId = sessionId;
        this.options = options;
        this.totalEvents = totalEvents;
        this.startTime = Instant.now();
        this.startMillis = System.currentTimeMillis();
    }

    public String getSessionId() {
        return sessionId;
    }

    public ReplayOptions getOptions() {
        return options;
    }

    public synchronized ReplayProgress progress() {
        return new ReplayProgress(totalEvents, processedEvents, currentTimestamp, startTime,
            elapsedMs, estimatedRemainingMs, eventsPerSecond, status, errors);
    }

    synchronized void recordProcessed(Instant eventTimestamp) {
        processedEvents++;
        currentTimestamp = eventTimestamp;
    }

    synchronized void recordError(String error) {
        errors.add(String.valueOf(error));
    }

    synchronized void updateMetrics() {
        elapsedMs = Math.max(1, System.currentTimeMillis() - startMillis);
        eventsPerSecond = processedEvents / (elapsedMs / 1000.0);
        estimatedRemainingMs = eventsPerSecond > 0
            ? (long) ((totalEvents - processedEvents) / eventsPerSecond * 1000)
            : 0;
    }

    synchronized void setStatus(ReplayStatus status) {
        this.status = status;
    }

    synchronized ReplayStatus getStatus() {
        return status;
    }

    boolean isPauseRequested() {
        return pauseRequested;
    }

    void setPauseRequested(boolean pauseRequested) {
        this.pauseRequested = pauseRequested;
    }

    boolean isStopRequested() {
        return stopRequested;
    }

    void requestStop() {
        this.stopRequested = true;
    }
}
