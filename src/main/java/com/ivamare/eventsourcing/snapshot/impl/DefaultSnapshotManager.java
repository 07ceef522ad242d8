package com.ivamare.eventsourcing.snapshot.impl;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.snapshot.SnapshotManager;
import com.ivamare.eventsourcing.snapshot.SnapshotStatistics;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of SnapshotManager.
 */
public class DefaultSnapshotManager implements SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultSnapshotManager.class);

    private final EventStore eventStore;
    private final AggregateFactories factories;
    private final int frequency;
    private final int maxAgeDays;
    private final Clock clock;

    public DefaultSnapshotManager(EventStore eventStore, AggregateFactories factories,
                                  int frequency, int maxAgeDays) {
        this(eventStore, factories, frequency, maxAgeDays, Clock.systemUTC());
    }

    public DefaultSnapshotManager(EventStore eventStore, AggregateFactories factories,
                                  int frequency, int maxAgeDays, Clock clock) {
        if (frequency < 1) {
            throw new IllegalArgumentException("frequency must be >= 1");
        }
        this.eventStore = eventStore;
        this.factories = factories;
        this.frequency = frequency;
        this.maxAgeDays = maxAgeDays;
        this.clock = clock;
    }

    @Override
    public Snapshot saveSnapshot(Aggregate aggregate) {
        Snapshot snapshot = eventStore.createSnapshot(
            aggregate.id(),
            aggregate.aggregateType(),
            aggregate.version(),
            aggregate.exportState()
        );
        log.debug("Saved snapshot for {}:{} at version {}",
            aggregate.aggregateType(), aggregate.id(), aggregate.version());
        return snapshot;
    }

    @Override
    public Optional<Aggregate> loadAggregate(String aggregateId, String aggregateType) {
        Aggregate aggregate = factories.create(aggregateType, aggregateId);

        Optional<Snapshot> snapshot = eventStore.getSnapshot(aggregateId);
        long fromVersion = 0;
        if (snapshot.isPresent()) {
            aggregate.importState(snapshot.get().state(), snapshot.get().version());
            fromVersion = snapshot.get().version();
            log.debug("Loaded {}:{} from snapshot at version {}", aggregateType, aggregateId, fromVersion);
        }

        List<DomainEvent> events = eventStore.getEvents(aggregateId, fromVersion);
        if (events.isEmpty() && snapshot.isEmpty()) {
            return Optional.empty();
        }
        aggregate.loadFromHistory(events);

        if (events.size() >= frequency) {
            saveSnapshot(aggregate);
        }
        return Optional.of(aggregate);
    }

    @Override
    public boolean shouldSnapshot(String aggregateId) {
        long latest = eventStore.getLatestVersion(aggregateId);
        long baseline = eventStore.getSnapshot(aggregateId).map(Snapshot::version).orElse(0L);
        return latest - baseline >= frequency;
    }

    @Override
    public void refreshSnapshot(String aggregateId, String aggregateType) {
        loadAggregate(aggregateId, aggregateType).ifPresent(this::saveSnapshot);
    }

    @Override
    public int maintainSnapshots() {
        log.info("Starting snapshot maintenance");
        Instant threshold = clock.instant().minus(Duration.ofDays(maxAgeDays));
        List<Snapshot> stale = eventStore.findSnapshotsOlderThan(threshold);

        int refreshed = 0;
        for (Snapshot snapshot : stale) {
            try {
                refreshSnapshot(snapshot.aggregateId(), snapshot.aggregateType());
                refreshed++;
            } catch (RuntimeException e) {
                log.error("Failed to refresh snapshot for {}:{}: {}",
                    snapshot.aggregateType(), snapshot.aggregateId(), e.getMessage(), e);
            }
        }
        log.info("Snapshot maintenance completed: {} of {} stale snapshots refreshed", refreshed, stale.size());
        return refreshed;
    }

    @Override
    public int cleanupSnapshots(int olderThanDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        int deleted = eventStore.deleteSnapshotsOlderThan(cutoff);
        log.info("Deleted {} snapshots older than {} days", deleted, olderThanDays);
        return deleted;
    }

    @Override
    public SnapshotStatistics getStatistics() {
        List<Snapshot> snapshots = eventStore.listSnapshots();
        if (snapshots.isEmpty()) {
            return SnapshotStatistics.empty();
        }
        long totalVersion = 0;
        Instant oldest = null;
        Instant newest = null;
        Map<String, Integer> byType = new HashMap<>();
        for (Snapshot snapshot : snapshots) {
            totalVersion += snapshot.version();
            if (oldest == null || snapshot.timestamp().isBefore(oldest)) {
                oldest = snapshot.timestamp();
            }
            if (newest == null || snapshot.timestamp().isAfter(newest)) {
                newest = snapshot.timestamp();
            }
            byType.merge(snapshot.aggregateType(), 1, Integer::sum);
        }
        long average = Math.round((double) totalVersion / snapshots.size());
        return new SnapshotStatistics(snapshots.size(), average, oldest, newest, byType);
    }

    public int getFrequency() {
        return frequency;
    }
}
