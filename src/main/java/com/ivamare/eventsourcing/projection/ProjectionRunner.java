package com.ivamare.eventsourcing.projection;

import com.ivamare.eventsourcing.exception.EventSourcingException;
import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.ProjectionNotFoundException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.store.EventQuery;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every registered projection in its own polling loop.
 *
 * <p>Each loop reads the next batch after the projection's last processed global
 * position, hands matching events to the projection and advances the position past
 * every event in the batch. An empty batch backs off briefly. A handler failure puts
 * the projection in {@link ProjectionState#ERROR}, backs off for the longer error
 * interval and retries the same event.
 *
 * <p>Batches and rebuilds of one projection are serialized by a per-projection lock.
 */
public class ProjectionRunner {

    private static final Logger log = LoggerFactory.getLogger(ProjectionRunner.class);

    private final EventStore eventStore;
    private final int batchSize;
    private final int rebuildBatchSize;
    private final long idleBackoffMs;
    private final long errorBackoffMs;

    private final Map<String, Tracker> trackers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger threadCounter = new AtomicInteger();

    private volatile ExecutorService executor;

    public ProjectionRunner(EventStore eventStore, int batchSize, int rebuildBatchSize,
                            long idleBackoffMs, long errorBackoffMs) {
        this.eventStore = eventStore;
        this.batchSize = batchSize;
        this.rebuildBatchSize = rebuildBatchSize;
        this.idleBackoffMs = idleBackoffMs;
        this.errorBackoffMs = errorBackoffMs;
    }

    /**
     * Register a projection. Starts its loop immediately if the runner is running.
     */
    public void register(Projection projection) {
        Tracker tracker = new Tracker(projection);
        if (trackers.putIfAbsent(projection.name(), tracker) != null) {
            throw new HandlerAlreadyRegisteredException("projection", projection.name());
        }
        log.info("Registered projection {} for {}", projection.name(), projection.eventTypes());
        if (running.get()) {
            launch(tracker);
        }
    }

    // --- Lifecycle ---

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "projection-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        trackers.values().forEach(this::launch);
        log.info("Started {} projections", trackers.size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ExecutorService current = executor;
        current.shutdown();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        trackers.values().forEach(t -> t.state = ProjectionState.PAUSED);
        log.info("All projections stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public void pause(String name) {
        Tracker tracker = tracker(name);
        tracker.paused = true;
        tracker.state = ProjectionState.PAUSED;
        log.info("Paused projection {}", name);
    }

    public void resume(String name) {
        Tracker tracker = tracker(name);
        tracker.paused = false;
        if (running.get()) {
            tracker.state = ProjectionState.RUNNING;
        }
        log.info("Resumed projection {}", name);
    }

    // --- Processing ---

    /**
     * Process one batch for a projection on the calling thread.
     *
     * <p>Failures are recorded on the projection, not thrown.
     *
     * @return number of events consumed, 0 when caught up or after a failure
     */
    public int processNextBatch(String name) {
        return processBatch(tracker(name));
    }

    /**
     * Reset a projection and replay the whole event history into it on the calling thread.
     *
     * @throws ProjectionNotFoundException if not registered
     * @throws EventSourcingException if the projection fails during the rebuild
     */
    public void rebuild(String name) {
        Tracker tracker = tracker(name);
        tracker.lock.lock();
        try {
            tracker.state = ProjectionState.REBUILDING;
            tracker.position = 0;
            tracker.processed.set(0);
            tracker.errorMessage = null;
            log.info("Rebuilding projection {}", name);

            tracker.projection.reset();

            while (true) {
                List<DomainEvent> events = eventStore.getAllEvents(EventQuery.builder()
                    .afterPosition(tracker.position)
                    .limit(rebuildBatchSize)
                    .build());
                if (events.isEmpty()) {
                    break;
                }
                for (DomainEvent event : events) {
                    apply(tracker, event);
                }
                log.debug("Rebuilt {} events for {}", tracker.processed.get(), name);
            }

            tracker.state = nextState(tracker);
            log.info("Projection {} rebuilt: {} events", name, tracker.processed.get());
        } catch (Exception e) {
            tracker.state = ProjectionState.ERROR;
            tracker.errorMessage = e.getMessage();
            log.error("Rebuild of projection {} failed: {}", name, e.getMessage(), e);
            throw new EventSourcingException("Rebuild of projection " + name + " failed", e);
        } finally {
            tracker.lock.unlock();
        }
    }

    // --- Status ---

    public ProjectionStatus getStatus(String name) {
        return toStatus(tracker(name), eventStore.getStreamPosition());
    }

    public List<ProjectionStatus> getStatuses() {
        long streamPosition = eventStore.getStreamPosition();
        return trackers.values().stream()
            .map(t -> toStatus(t, streamPosition))
            .toList();
    }

    public List<String> projectionNames() {
        return List.copyOf(trackers.keySet());
    }

    // --- Internals ---

    private void launch(Tracker tracker) {
        executor.submit(() -> runLoop(tracker));
    }

    private void runLoop(Tracker tracker) {
        String name = tracker.projection.name();
        log.debug("Projection loop started for {}", name);
        if (!tracker.paused) {
            tracker.state = ProjectionState.RUNNING;
        }

        while (running.get() && !Thread.currentThread().isInterrupted()) {
            if (tracker.paused) {
                sleep(idleBackoffMs);
                continue;
            }
            int consumed = processBatch(tracker);
            if (tracker.state == ProjectionState.ERROR) {
                sleep(errorBackoffMs);
            } else if (consumed == 0) {
                sleep(idleBackoffMs);
            }
        }
        log.debug("Projection loop exited for {}", name);
    }

    private int processBatch(Tracker tracker) {
        if (!tracker.lock.tryLock()) {
            // Rebuild in progress
            return 0;
        }
        try {
            if (tracker.state == ProjectionState.ERROR) {
                tracker.state = nextState(tracker);
            }
            List<DomainEvent> events = eventStore.getAllEvents(EventQuery.builder()
                .afterPosition(tracker.position)
                .limit(batchSize)
                .build());
            for (DomainEvent event : events) {
                apply(tracker, event);
            }
            return events.size();
        } catch (Exception e) {
            tracker.state = ProjectionState.ERROR;
            tracker.errorMessage = e.getMessage();
            log.error("Projection {} error at position {}: {}",
                tracker.projection.name(), tracker.position, e.getMessage(), e);
            return 0;
        } finally {
            tracker.lock.unlock();
        }
    }

    private void apply(Tracker tracker, DomainEvent event) throws Exception {
        if (tracker.projection.interestedIn(event)) {
            tracker.projection.handle(event);
            tracker.processed.incrementAndGet();
            tracker.lastProcessedTimestamp = event.timestamp();
        }
        tracker.position = event.position();
    }

    private ProjectionState nextState(Tracker tracker) {
        return running.get() && !tracker.paused ? ProjectionState.RUNNING : ProjectionState.PAUSED;
    }

    private ProjectionStatus toStatus(Tracker tracker, long streamPosition) {
        return new ProjectionStatus(
            tracker.projection.name(),
            tracker.state,
            tracker.position,
            tracker.lastProcessedTimestamp,
            tracker.errorMessage,
            tracker.processed.get(),
            Math.max(0, streamPosition - tracker.position)
        );
    }

    private Tracker tracker(String name) {
        Tracker tracker = trackers.get(name);
        if (tracker == null) {
            throw new ProjectionNotFoundException(name);
        }
        return tracker;
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Tracker {

        private final Projection projection;
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicLong processed = new AtomicLong();

        private volatile ProjectionState state = ProjectionState.PAUSED;
        private volatile long position;
        private volatile Instant lastProcessedTimestamp;
        private volatile String errorMessage;
        private volatile boolean paused;

        private Tracker(Projection projection) {
            this.projection = projection;
        }
    }
}
