package com.ivamare.eventsourcing.replay;

import com.ivamare.eventsourcing.model.DomainEvent;

import java.util.List;
import java.util.Map;

/**
 * Event prefix of an aggregate up to a point in time, with the state it produces.
 *
 * @param events        events with timestamp at or before the target
 * @param reconstructed whether {@code state} was rebuilt from the prefix
 * @param version       version reached by the prefix
 * @param state         exported state, empty when not reconstructed
 */
public record TimeTravelResult(
    List<DomainEvent> events,
    boolean reconstructed,
    long version,
    Map<String, Object> state
) {

    public TimeTravelResult {
        events = List.copyOf(events);
        state = state == null ? Map.of() : state;
    }
}
