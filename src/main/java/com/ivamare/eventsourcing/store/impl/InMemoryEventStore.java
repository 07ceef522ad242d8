package com.ivamare.eventsourcing.store.impl;

import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.store.EventQuery;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Process-local event store.
 *
 * <p>All operations are synchronized on the store, which makes each append atomic.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<DomainEvent> BY_TIMESTAMP = Comparator
        .comparing(DomainEvent::timestamp)
        .thenComparingLong(DomainEvent::position);

    private final Clock clock;
    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, List<Entry>> streams = new HashMap<>();
    private final Map<String, Snapshot> snapshots = new LinkedHashMap<>();

    private long position;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized List<DomainEvent> append(List<DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }

        // Validate the whole batch before touching the log
        Map<String, Long> versions = new HashMap<>();
        for (DomainEvent event : events) {
            long current = versions.computeIfAbsent(event.aggregateId(), this::getLatestVersion);
            if (event.version() != current + 1) {
                throw new ConcurrencyConflictException(event.aggregateId(), current + 1, event.version());
            }
            versions.put(event.aggregateId(), event.version());
        }

        List<DomainEvent> stored = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            DomainEvent withPosition = event.withPosition(++position);
            Entry entry = new Entry(withPosition);
            entries.add(entry);
            streams.computeIfAbsent(event.aggregateId(), id -> new ArrayList<>()).add(entry);
            stored.add(withPosition);
        }
        log.debug("Appended {} events, stream position {}", stored.size(), position);
        return stored;
    }

    @Override
    public synchronized List<DomainEvent> getEvents(String aggregateId, long fromVersion) {
        return streams.getOrDefault(aggregateId, List.of()).stream()
            .map(Entry::event)
            .filter(e -> e.version() > fromVersion)
            .toList();
    }

    @Override
    public synchronized List<DomainEvent> getAllEvents(EventQuery query) {
        Stream<DomainEvent> matching = entries.stream()
            .filter(entry -> !(query.excludeArchived() && entry.archived))
            .map(Entry::event)
            .filter(query::matches);
        if (!query.orderedByPosition()) {
            matching = matching.sorted(BY_TIMESTAMP);
        }
        if (query.offset() != null && query.offset() > 0) {
            matching = matching.skip(query.offset());
        }
        if (query.limit() != null && query.limit() > 0) {
            matching = matching.limit(query.limit());
        }
        return matching.toList();
    }

    @Override
    public synchronized long getEventCount(String aggregateId) {
        return streams.getOrDefault(aggregateId, List.of()).size();
    }

    @Override
    public synchronized long getLatestVersion(String aggregateId) {
        List<Entry> stream = streams.get(aggregateId);
        if (stream == null || stream.isEmpty()) {
            return 0;
        }
        return stream.get(stream.size() - 1).event().version();
    }

    @Override
    public synchronized long getStreamPosition() {
        return position;
    }

    @Override
    public synchronized Snapshot createSnapshot(String aggregateId, String aggregateType, long version,
                                                Map<String, Object> state) {
        long latest = getLatestVersion(aggregateId);
        if (version > latest) {
            throw new IllegalArgumentException("Snapshot version " + version
                + " is ahead of latest event version " + latest + " for aggregate " + aggregateId);
        }
        Snapshot snapshot = new Snapshot(aggregateId, aggregateType, version, state, clock.instant());
        snapshots.put(aggregateId, snapshot);
        return snapshot;
    }

    @Override
    public synchronized Optional<Snapshot> getSnapshot(String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public synchronized List<Snapshot> listSnapshots() {
        return List.copyOf(snapshots.values());
    }

    @Override
    public synchronized List<Snapshot> findSnapshotsOlderThan(Instant threshold) {
        return snapshots.values().stream()
            .filter(s -> s.timestamp().isBefore(threshold))
            .toList();
    }

    @Override
    public synchronized int deleteSnapshotsOlderThan(Instant threshold) {
        int before = snapshots.size();
        snapshots.values().removeIf(s -> s.timestamp().isBefore(threshold));
        return before - snapshots.size();
    }

    @Override
    public synchronized int archiveEvents(Instant before) {
        int count = 0;
        for (Entry entry : entries) {
            if (!entry.archived && entry.event().timestamp().isBefore(before)) {
                entry.archived = true;
                count++;
            }
        }
        log.info("Archived {} events before {}", count, before);
        return count;
    }

    /**
     * @return true if the event at the given position has been archived
     */
    public synchronized boolean isArchived(long eventPosition) {
        return entries.stream()
            .anyMatch(entry -> entry.event().position() == eventPosition && entry.archived);
    }

    private static final class Entry {

        private final DomainEvent event;
        private boolean archived;

        private Entry(DomainEvent event) {
            this.event = event;
        }

        DomainEvent event() {
            return event;
        }
    }
}
