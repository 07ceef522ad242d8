package com.ivamare.eventsourcing.projection;

import com.ivamare.eventsourcing.model.DomainEvent;

import java.util.Set;

/**
 * Read model built incrementally by folding events.
 */
public interface Projection {

    /**
     * Interest set entry that matches every event type.
     */
    String WILDCARD = "*";

    String name();

    /**
     * Event types this projection handles, or {@link #WILDCARD}.
     */
    Set<String> eventTypes();

    void handle(DomainEvent event) throws Exception;

    /**
     * Clear the read model before a rebuild.
     */
    default void reset() {
    }

    default boolean interestedIn(DomainEvent event) {
        Set<String> types = eventTypes();
        return types.contains(WILDCARD) || types.contains(event.eventType());
    }
}
