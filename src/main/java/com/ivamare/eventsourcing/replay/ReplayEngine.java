package com.ivamare.eventsourcing.replay;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.notify.NotificationChannel;
import com.ivamare.eventsourcing.notify.NotificationTopics;
import com.ivamare.eventsourcing.store.EventQuery;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Replays historical events into the dispatcher for diagnostics and reconstruction.
 *
 * <p>Sessions run in the background. Pause is honoured between batches and stop
 * between events. Per-event dispatch failures are recorded on the session and do not
 * abort it. Finished sessions remain queryable through {@link #getProgress(String)}
 * until {@value #FINISHED_RETENTION} newer sessions have finished.
 */
public class ReplayEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    static final int FINISHED_RETENTION = 100;

    private final EventStore eventStore;
    private final EventDispatcher dispatcher;
    private final NotificationChannel notificationChannel;
    private final AggregateFactories factories;
    private final int defaultBatchSize;
    private final long defaultPauseBetweenBatchesMs;
    private final long maxEventDelayMs;
    private final long pausePollMs;

    private final Map<String, ReplaySession> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, ReplaySession> finishedSessions = new LinkedHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor;

    public ReplayEngine(EventStore eventStore, EventDispatcher dispatcher,
                        NotificationChannel notificationChannel, AggregateFactories factories,
                        int defaultBatchSize, long defaultPauseBetweenBatchesMs,
                        long maxEventDelayMs, long pausePollMs) {
        this.eventStore = eventStore;
        this.dispatcher = dispatcher;
        this.notificationChannel = notificationChannel;
        this.factories = factories;
        this.defaultBatchSize = defaultBatchSize;
        this.defaultPauseBetweenBatchesMs = defaultPauseBetweenBatchesMs;
        this.maxEventDelayMs = maxEventDelayMs;
        this.pausePollMs = pausePollMs;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "replay-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // --- Sessions ---

    /**
     * Materialize the filtered events and replay them in the background.
     *
     * @return session id
     */
    public String startReplay(ReplayOptions options) {
        ReplayOptions effective = options != null ? options : ReplayOptions.builder().build();
        List<DomainEvent> events = selectEvents(effective);

        String sessionId = "replay-" + UUID.randomUUID();
        ReplaySession session = new ReplaySession(sessionId, effective, events.size());
        activeSessions.put(sessionId, session);
        log.info("Starting replay session {} with {} events (dryRun={})",
            sessionId, events.size(), effective.dryRun());

        executor.submit(() -> runSession(session, events));
        return sessionId;
    }

    public boolean pauseReplay(String sessionId) {
        ReplaySession session = activeSessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.setPauseRequested(true);
        log.info("Pause requested for replay session {}", sessionId);
        return true;
    }

    public boolean resumeReplay(String sessionId) {
        ReplaySession session = activeSessions.get(sessionId);
        if (session == null || !session.isPauseRequested()) {
            return false;
        }
        session.setPauseRequested(false);
        session.setStatus(ReplayStatus.RUNNING);
        log.info("Resumed replay session {}", sessionId);
        return true;
    }

    /**
     * Stop and discard a session. The replay thread exits at the next event boundary.
     */
    public boolean stopReplay(String sessionId) {
        ReplaySession session = activeSessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.requestStop();
        notificationChannel.publish(NotificationTopics.REPLAY_STOPPED,
            new ReplayNotification(sessionId, null, session.progress()));
        log.info("Stopped replay session {}", sessionId);
        return true;
    }

    public Optional<ReplayProgress> getProgress(String sessionId) {
        ReplaySession session = activeSessions.get(sessionId);
        if (session == null) {
            synchronized (finishedSessions) {
                session = finishedSessions.get(sessionId);
            }
        }
        return Optional.ofNullable(session).map(ReplaySession::progress);
    }

    public List<ReplaySession> getActiveSessions() {
        return List.copyOf(activeSessions.values());
    }

    private void runSession(ReplaySession session, List<DomainEvent> events) {
        String sessionId = session.getSessionId();
        ReplayOptions options = session.getOptions();
        int batchSize = options.batchSize() != null && options.batchSize() > 0
            ? options.batchSize()
            : defaultBatchSize;
        long pauseBetweenBatches = options.pauseBetweenBatchesMs() != null
            ? options.pauseBetweenBatchesMs()
            : defaultPauseBetweenBatchesMs;

        try {
            Instant lastEventTime = null;
            for (int i = 0; i < events.size(); i += batchSize) {
                if (session.isPauseRequested()) {
                    session.setStatus(ReplayStatus.PAUSED);
                    waitUntilResumed(session);
                }
                if (cancelled(session)) {
                    return;
                }

                List<DomainEvent> batch = events.subList(i, Math.min(i + batchSize, events.size()));
                for (DomainEvent event : batch) {
                    if (cancelled(session)) {
                        return;
                    }
                    if (options.paced() && lastEventTime != null) {
                        sleep(pacedDelay(lastEventTime, event.timestamp(), options.speed()));
                    }
                    lastEventTime = event.timestamp();

                    replayOne(session, event, options.dryRun());
                    session.recordProcessed(event.timestamp());
                    notificationChannel.publish(NotificationTopics.REPLAY_PROGRESS,
                        new ReplayNotification(sessionId, event, session.progress()));
                }
                session.updateMetrics();

                if (pauseBetweenBatches > 0) {
                    sleep(pauseBetweenBatches);
                }
            }

            session.updateMetrics();
            session.setStatus(ReplayStatus.COMPLETED);
            ReplayProgress progress = session.progress();
            log.info("Replay session {} completed: {} events processed, {} errors",
                sessionId, progress.processedEvents(), progress.errors().size());
            notificationChannel.publish(NotificationTopics.REPLAY_COMPLETED,
                new ReplayNotification(sessionId, null, progress));
        } catch (RuntimeException e) {
            session.setStatus(ReplayStatus.ERROR);
            session.recordError(describe(e));
            log.error("Replay session {} failed: {}", sessionId, e.getMessage(), e);
        } finally {
            finish(session);
        }
    }

    private void replayOne(ReplaySession session, DomainEvent event, boolean dryRun) {
        if (dryRun) {
            return;
        }
        try {
            dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            session.recordError("Event " + event.eventId() + ": " + describe(e));
            log.warn("Error replaying event {} in session {}: {}",
                event.eventId(), session.getSessionId(), describe(e));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    long pacedDelay(Instant previous, Instant current, double speed) {
        long deltaMs = Duration.between(previous, current).toMillis();
        if (deltaMs <= 0) {
            return 0;
        }
        return Math.min((long) (deltaMs / speed), maxEventDelayMs);
    }

    private void waitUntilResumed(ReplaySession session) {
        while (session.isPauseRequested() && !cancelled(session)) {
            sleep(pausePollMs);
        }
    }

    private boolean cancelled(ReplaySession session) {
        return session.isStopRequested() || Thread.currentThread().isInterrupted();
    }

    private void finish(ReplaySession session) {
        if (activeSessions.remove(session.getSessionId()) == null) {
            // Stopped by caller
            return;
        }
        synchronized (finishedSessions) {
            finishedSessions.put(session.getSessionId(), session);
            if (finishedSessions.size() > FINISHED_RETENTION) {
                String eldest = finishedSessions.keySet().iterator().next();
                finishedSessions.remove(eldest);
            }
        }
    }

    // --- Direct operations ---

    /**
     * Re-dispatch one aggregate's history synchronously. Dispatch failures propagate.
     *
     * @param toVersion highest version to include, null for all
     * @return the selected events
     */
    public List<DomainEvent> replayAggregate(String aggregateId, Long toVersion, boolean dryRun) {
        List<DomainEvent> events = eventStore.getEvents(aggregateId).stream()
            .filter(e -> toVersion == null || e.version() <= toVersion)
            .toList();
        if (!dryRun) {
            events.forEach(dispatcher::dispatch);
        }
        log.info("Replayed {} events of aggregate {} (dryRun={})", events.size(), aggregateId, dryRun);
        return events;
    }

    /**
     * Compare two event streams position by position on event type and payload.
     */
    public StreamComparison compareStreams(String aggregateId1, String aggregateId2) {
        List<DomainEvent> first = eventStore.getEvents(aggregateId1);
        List<DomainEvent> second = eventStore.getEvents(aggregateId2);

        int matching = 0;
        List<StreamDifference> differences = new ArrayList<>();
        int length = Math.max(first.size(), second.size());
        for (int i = 0; i < length; i++) {
            long version = i + 1L;
            if (i >= first.size()) {
                differences.add(new StreamDifference(version, "Missing in stream 1"));
            } else if (i >= second.size()) {
                differences.add(new StreamDifference(version, "Missing in stream 2"));
            } else {
                DomainEvent e1 = first.get(i);
                DomainEvent e2 = second.get(i);
                if (!e1.eventType().equals(e2.eventType())) {
                    differences.add(new StreamDifference(version,
                        "Event type mismatch: " + e1.eventType() + " vs " + e2.eventType()));
                } else if (!Objects.equals(e1.payload(), e2.payload())) {
                    differences.add(new StreamDifference(version, "Payload mismatch"));
                } else {
                    matching++;
                }
            }
        }
        return new StreamComparison(matching, differences);
    }

    /**
     * Events of an aggregate up to and including {@code timestamp}. State is not rebuilt.
     */
    public TimeTravelResult timeTravel(String aggregateId, Instant timestamp) {
        List<DomainEvent> prefix = prefix(aggregateId, timestamp);
        long version = prefix.isEmpty() ? 0 : prefix.get(prefix.size() - 1).version();
        return new TimeTravelResult(prefix, false, version, Map.of());
    }

    /**
     * Events of an aggregate up to {@code timestamp}, plus the state they produce when a
     * factory is registered for {@code aggregateType}.
     */
    public TimeTravelResult timeTravel(String aggregateId, String aggregateType, Instant timestamp) {
        if (!factories.contains(aggregateType)) {
            return timeTravel(aggregateId, timestamp);
        }
        List<DomainEvent> prefix = prefix(aggregateId, timestamp);
        Aggregate aggregate = factories.create(aggregateType, aggregateId);
        aggregate.loadFromHistory(prefix);
        return new TimeTravelResult(prefix, true, aggregate.version(), aggregate.exportState());
    }

    private List<DomainEvent> prefix(String aggregateId, Instant timestamp) {
        return eventStore.getEvents(aggregateId).stream()
            .filter(e -> !e.timestamp().isAfter(timestamp))
            .toList();
    }

    private List<DomainEvent> selectEvents(ReplayOptions options) {
        EventQuery query = EventQuery.builder()
            .from(options.from())
            .to(options.to())
            .eventTypes(options.eventTypes())
            .aggregateIds(options.aggregateIds())
            .build();
        return eventStore.getAllEvents(query).stream()
            .filter(e -> options.aggregateTypes().isEmpty() || options.aggregateTypes().contains(e.aggregateType()))
            .toList();
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stop all sessions and release the replay threads.
     */
    @Override
    public void close() {
        activeSessions.values().forEach(ReplaySession::requestStop);
        activeSessions.clear();
        executor.shutdownNow();
    }
}
