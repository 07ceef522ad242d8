package com.ivamare.eventsourcing.store;

import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.model.Snapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only log of domain events with per-aggregate optimistic concurrency.
 */
public interface EventStore {

    /**
     * Append a batch of events atomically.
     *
     * <p>Each event must carry exactly the next version of its aggregate, taking earlier
     * events of the same batch into account. Either every event is stored or none is.
     *
     * @param events events to append, in order
     * @return the stored events with their global positions assigned
     * @throws ConcurrencyConflictException if any event does not carry the next version
     */
    List<DomainEvent> append(List<DomainEvent> events);

    /**
     * Get events of one aggregate with {@code version > fromVersion}, ascending.
     */
    List<DomainEvent> getEvents(String aggregateId, long fromVersion);

    default List<DomainEvent> getEvents(String aggregateId) {
        return getEvents(aggregateId, 0);
    }

    /**
     * Get events across all aggregates. Archived events are included unless excluded by the query.
     */
    List<DomainEvent> getAllEvents(EventQuery query);

    default List<DomainEvent> getEventsByType(String eventType, EventQuery query) {
        EventQuery base = query != null ? query : EventQuery.all();
        return getAllEvents(base.toBuilder().eventType(eventType).build());
    }

    long getEventCount(String aggregateId);

    /**
     * @return highest stored version, 0 when the aggregate has no events
     */
    long getLatestVersion(String aggregateId);

    /**
     * @return highest assigned global position, 0 when the store is empty
     */
    long getStreamPosition();

    // --- Snapshots ---

    /**
     * Create or replace the snapshot of an aggregate.
     *
     * @throws IllegalArgumentException if version is above the latest stored version
     */
    Snapshot createSnapshot(String aggregateId, String aggregateType, long version, Map<String, Object> state);

    Optional<Snapshot> getSnapshot(String aggregateId);

    List<Snapshot> listSnapshots();

    List<Snapshot> findSnapshotsOlderThan(Instant threshold);

    /**
     * @return number of deleted snapshots
     */
    int deleteSnapshotsOlderThan(Instant threshold);

    // --- Maintenance ---

    /**
     * Flag events before the given instant as archived. Archived events stay readable.
     *
     * @return number of newly archived events
     */
    int archiveEvents(Instant before);

    // --- Subscription ---

    default EventSubscription subscribe(long fromPosition) {
        return subscribe(fromPosition, EventSubscription.DEFAULT_BATCH_SIZE, EventSubscription.DEFAULT_POLL_INTERVAL);
    }

    /**
     * Open a polling cursor that yields every event after {@code fromPosition} in position order.
     */
    default EventSubscription subscribe(long fromPosition, int batchSize, Duration pollInterval) {
        return new EventSubscription(this, fromPosition, batchSize, pollInterval);
    }
}
