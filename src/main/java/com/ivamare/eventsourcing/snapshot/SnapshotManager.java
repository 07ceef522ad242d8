package com.ivamare.eventsourcing.snapshot;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.model.Snapshot;

import java.util.Optional;

/**
 * Captures aggregate state and loads aggregates from snapshot plus delta.
 */
public interface SnapshotManager {

    /**
     * Export the aggregate's state and store it as the aggregate's only snapshot.
     */
    Snapshot saveSnapshot(Aggregate aggregate);

    /**
     * Load an aggregate: restore from its snapshot if one exists, then replay only the
     * events after the snapshot version. Takes a fresh snapshot when the number of
     * replayed events reaches the configured frequency.
     *
     * @return the aggregate, or empty when there is neither a snapshot nor any event
     * @throws com.ivamare.eventsourcing.exception.AggregateFactoryNotFoundException if the type is unknown
     */
    Optional<Aggregate> loadAggregate(String aggregateId, String aggregateType);

    /**
     * Typed variant of {@link #loadAggregate(String, String)}.
     */
    default <A extends Aggregate> Optional<A> loadAggregate(String aggregateId, String aggregateType,
                                                            Class<A> aggregateClass) {
        return loadAggregate(aggregateId, aggregateType).map(aggregateClass::cast);
    }

    /**
     * @return true when at least {@code frequency} events were stored since the last snapshot
     */
    boolean shouldSnapshot(String aggregateId);

    /**
     * Reload the aggregate and store a new snapshot of it.
     */
    void refreshSnapshot(String aggregateId, String aggregateType);

    /**
     * Refresh every snapshot older than the configured max age. Failures are logged per
     * aggregate and do not stop the run.
     *
     * @return number of refreshed snapshots
     */
    int maintainSnapshots();

    /**
     * Delete snapshots older than the given number of days.
     *
     * @return number of deleted snapshots
     */
    int cleanupSnapshots(int olderThanDays);

    SnapshotStatistics getStatistics();
}
