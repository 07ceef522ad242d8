package com.ivamare.eventsourcing.store;

import com.ivamare.eventsourcing.model.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polling cursor over the global event stream.
 *
 * <p>The sequence is infinite: {@link #hasNext()} blocks, polling the store at a fixed
 * interval, until an event arrives or the subscription is closed. A new subscription
 * created from {@link #position()} resumes exactly where this one stopped.
 *
 * <p>Not thread-safe except for {@link #close()}, which may be called from any thread.
 * The buffer is only touched by the consuming thread; {@code close()} just raises a flag.
 */
public class EventSubscription implements Iterator<DomainEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);

    static final int DEFAULT_BATCH_SIZE = 100;
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final EventStore eventStore;
    private final int batchSize;
    private final long pollIntervalMs;
    private final Deque<DomainEvent> buffer = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private long position;

    public EventSubscription(EventStore eventStore, long fromPosition, int batchSize, Duration pollInterval) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.eventStore = eventStore;
        this.position = fromPosition;
        this.batchSize = batchSize;
        this.pollIntervalMs = Math.max(1, pollInterval.toMillis());
    }

    @Override
    public boolean hasNext() {
        while (!closed.get()) {
            if (!buffer.isEmpty() || fetch()) {
                return true;
            }
            if (!sleep(pollIntervalMs)) {
                close();
            }
        }
        buffer.clear();
        return false;
    }

    @Override
    public DomainEvent next() {
        // hasNext() leaves the buffer non-empty when it returns true
        if (buffer.isEmpty() && !hasNext()) {
            throw new NoSuchElementException("Subscription closed");
        }
        return take();
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the next event, or empty on timeout or close
     */
    public Optional<DomainEvent> poll(Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (!closed.get()) {
            if (!buffer.isEmpty() || fetch()) {
                return Optional.of(take());
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return Optional.empty();
            }
            if (!sleep(Math.min(remaining, pollIntervalMs))) {
                close();
            }
        }
        buffer.clear();
        return Optional.empty();
    }

    /**
     * Position of the last event handed out.
     */
    public long position() {
        return position;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Subscription closed at position {}", position);
        }
    }

    private DomainEvent take() {
        DomainEvent event = buffer.poll();
        position = event.position();
        return event;
    }

    private boolean fetch() {
        long after = buffer.isEmpty() ? position : buffer.peekLast().position();
        List<DomainEvent> events = eventStore.getAllEvents(EventQuery.builder()
            .afterPosition(after)
            .limit(batchSize)
            .build());
        buffer.addAll(events);
        return !events.isEmpty();
    }

    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
