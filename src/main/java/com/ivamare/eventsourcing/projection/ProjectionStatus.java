package com.ivamare.eventsourcing.projection;

import java.time.Instant;

/**
 * Point-in-time view of a projection.
 *
 * @param name                   projection name
 * @param state                  current state
 * @param lastProcessedPosition  global position of the last consumed event
 * @param lastProcessedTimestamp timestamp of the last handled event
 * @param errorMessage           last failure, null if none
 * @param eventsProcessed        handled event count
 * @param lag                    stream position minus last processed position
 */
public record ProjectionStatus(
    String name,
    ProjectionState state,
    long lastProcessedPosition,
    Instant lastProcessedTimestamp,
    String errorMessage,
    long eventsProcessed,
    long lag
) {
}
