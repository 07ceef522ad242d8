package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.DomainEvent;

import java.util.List;
import java.util.Map;

/**
 * Consistency boundary whose state is derived solely from its own ordered events.
 */
public interface Aggregate {

    String id();

    String aggregateType();

    /**
     * Version of the last applied event, 0 for a blank aggregate.
     */
    long version();

    /**
     * Apply a new event: run the state transition, buffer the event as uncommitted
     * and advance the version.
     */
    void applyEvent(DomainEvent event);

    /**
     * Replay stored events without buffering them.
     */
    void loadFromHistory(List<DomainEvent> events);

    List<DomainEvent> uncommittedEvents();

    void markEventsCommitted();

    /**
     * Export the materialized state for a snapshot.
     */
    Map<String, Object> exportState();

    /**
     * Restore state from a snapshot taken at {@code version}.
     */
    void importState(Map<String, Object> state, long version);
}
