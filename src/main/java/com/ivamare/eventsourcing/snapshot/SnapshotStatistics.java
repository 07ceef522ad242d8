package com.ivamare.eventsourcing.snapshot;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over all stored snapshots.
 *
 * @param totalSnapshots  number of snapshots
 * @param averageVersion  rounded mean snapshot version
 * @param oldestSnapshot  oldest capture time, null when empty
 * @param newestSnapshot  newest capture time, null when empty
 * @param byAggregateType snapshot count per aggregate type
 */
public record SnapshotStatistics(
    int totalSnapshots,
    long averageVersion,
    Instant oldestSnapshot,
    Instant newestSnapshot,
    Map<String, Integer> byAggregateType
) {

    public SnapshotStatistics {
        byAggregateType = byAggregateType == null ? Map.of() : Map.copyOf(byAggregateType);
    }

    public static SnapshotStatistics empty() {
        return new SnapshotStatistics(0, 0, null, null, Map.of());
    }
}
