package com.ivamare.eventsourcing.replay;

import java.util.List;

/**
 * Result of comparing two aggregates' event streams position by position.
 *
 * @param matching    positions with equal type and payload
 * @param differences positions that differ or exist in one stream only
 */
public record StreamComparison(int matching, List<StreamDifference> differences) {

    public StreamComparison {
        differences = List.copyOf(differences);
    }

    public boolean identical() {
        return differences.isEmpty();
    }
}
