package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.model.EventMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for aggregates.
 *
 * <p>Subclasses implement {@link #transition(DomainEvent)} as a switch over the event
 * type, and mutate state only from there. Command methods validate their invariants
 * and then call {@link #raise(String, Map, EventMetadata)}.
 *
 * <pre>
 * public void rename(String name) {
 *     if (deleted) {
 *         throw new IllegalStateException("deleted");
 *     }
 *     raise("Renamed", Map.of("name", name), EventMetadata.empty());
 * }
 *
 * protected void transition(DomainEvent event) {
 *     switch (event.eventType()) {
 *         case "Renamed" -&gt; this.name = (String) event.payload().get("name");
 *         default -&gt; { }
 *     }
 * }
 * </pre>
 */
public abstract class AbstractAggregate implements Aggregate {

    private final String id;
    private final List<DomainEvent> uncommitted = new ArrayList<>();
    private long version;

    protected AbstractAggregate(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Type-specific state transition. Must not fail for events already stored.
     */
    protected abstract void transition(DomainEvent event);

    /**
     * Restore fields from exported state.
     */
    protected abstract void restoreState(Map<String, Object> state);

    @Override
    public String id() {
        return id;
    }

    @Override
    public long version() {
        return version;
    }

    /**
     * Record a new event at the next version.
     */
    protected DomainEvent raise(String eventType, Map<String, Object> payload, EventMetadata metadata) {
        DomainEvent event = DomainEvent.create(id, aggregateType(), eventType, version + 1, payload, metadata);
        applyEvent(event);
        return event;
    }

    @Override
    public void applyEvent(DomainEvent event) {
        if (event.version() != version + 1) {
            throw new IllegalStateException("Event version " + event.version()
                + " does not follow aggregate version " + version + " for " + id);
        }
        transition(event);
        uncommitted.add(event);
        version = event.version();
    }

    @Override
    public void loadFromHistory(List<DomainEvent> events) {
        for (DomainEvent event : events) {
            transition(event);
            version = event.version();
        }
    }

    @Override
    public List<DomainEvent> uncommittedEvents() {
        return List.copyOf(uncommitted);
    }

    @Override
    public void markEventsCommitted() {
        uncommitted.clear();
    }

    @Override
    public void importState(Map<String, Object> state, long version) {
        restoreState(state);
        this.version = version;
    }
}
