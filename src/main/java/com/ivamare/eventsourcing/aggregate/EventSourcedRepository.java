package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.snapshot.SnapshotManager;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Loads aggregates through the snapshot manager and persists their new events.
 *
 * <p>Typical command handler:
 * <pre>
 * PortalAggregate portal = repository.load(id, "Portal", PortalAggregate.class)
 *     .orElseThrow(() -&gt; new ValidationException("Unknown portal " + id));
 * portal.rename(name);
 * repository.save(portal);
 * </pre>
 */
public class EventSourcedRepository {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore eventStore;
    private final SnapshotManager snapshotManager;
    private final EventDispatcher dispatcher;

    public EventSourcedRepository(EventStore eventStore, SnapshotManager snapshotManager,
                                  EventDispatcher dispatcher) {
        this.eventStore = eventStore;
        this.snapshotManager = snapshotManager;
        this.dispatcher = dispatcher;
    }

    public Optional<Aggregate> load(String aggregateId, String aggregateType) {
        return snapshotManager.loadAggregate(aggregateId, aggregateType);
    }

    public <A extends Aggregate> Optional<A> load(String aggregateId, String aggregateType, Class<A> aggregateClass) {
        return snapshotManager.loadAggregate(aggregateId, aggregateType, aggregateClass);
    }

    /**
     * Append the aggregate's uncommitted events, dispatch them and snapshot when due.
     *
     * <p>Conflicts and dispatch failures propagate to the caller.
     *
     * @return the stored events
     */
    public List<DomainEvent> save(Aggregate aggregate) {
        List<DomainEvent> pending = aggregate.uncommittedEvents();
        if (pending.isEmpty()) {
            return List.of();
        }

        List<DomainEvent> stored = eventStore.append(pending);
        aggregate.markEventsCommitted();
        log.debug("Saved {} events for {}:{} (version {})",
            stored.size(), aggregate.aggregateType(), aggregate.id(), aggregate.version());

        for (DomainEvent event : stored) {
            dispatcher.dispatch(event);
        }

        if (snapshotManager.shouldSnapshot(aggregate.id())) {
            snapshotManager.saveSnapshot(aggregate);
        }
        return stored;
    }
}
