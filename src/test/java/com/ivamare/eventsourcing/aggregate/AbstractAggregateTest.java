package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.DomainEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AbstractAggregateTest {

    @Test
    void shouldRaiseEventsAtIncreasingVersions() {
        PortalAggregate portal = PortalAggregate.create("p-1", "Home");
        portal.rename("Start");

        List<DomainEvent> pending = portal.uncommittedEvents();

        assertEquals(2, portal.version());
        assertEquals(List.of(1L, 2L), pending.stream().map(DomainEvent::version).toList());
        assertEquals("PortalRenamed", pending.get(1).eventType());
        assertEquals(PortalAggregate.TYPE, pending.get(1).aggregateType());
        assertEquals("Start", portal.name());
    }

    @Test
    void shouldClearPendingEventsWhenCommitted() {
        PortalAggregate portal = PortalAggregate.create("p-1", "Home");

        portal.markEventsCommitted();

        assertTrue(portal.uncommittedEvents().isEmpty());
        assertEquals(1, portal.version());
    }

    @Test
    void shouldRejectEventOutOfSequence() {
        PortalAggregate portal = PortalAggregate.create("p-1", "Home");
        DomainEvent skipped = DomainEvent.create("p-1", PortalAggregate.TYPE, "PortalRenamed", 3,
            Map.of("name", "x"), null);

        assertThrows(IllegalStateException.class, () -> portal.applyEvent(skipped));
        assertEquals("Home", portal.name());
    }

    @Test
    void shouldRebuildFromHistoryWithoutPendingEvents() {
        PortalAggregate source = PortalAggregate.create("p-1", "Home");
        source.addWidget("clock");
        source.delete();

        PortalAggregate rebuilt = new PortalAggregate("p-1");
        rebuilt.loadFromHistory(source.uncommittedEvents());

        assertEquals(3, rebuilt.version());
        assertTrue(rebuilt.isDeleted());
        assertEquals(List.of("clock"), rebuilt.widgets());
        assertTrue(rebuilt.uncommittedEvents().isEmpty());
    }

    @Test
    void shouldRoundTripExportedState() {
        PortalAggregate source = PortalAggregate.create("p-1", "Home");
        source.addWidget("clock");

        PortalAggregate restored = new PortalAggregate("p-1");
        restored.importState(source.exportState(), source.version());

        assertEquals(source.exportState(), restored.exportState());
        assertEquals(2, restored.version());
    }

    @Test
    void shouldEnforceDomainInvariantBeforeRaising() {
        PortalAggregate portal = PortalAggregate.create("p-1", "Home");
        portal.delete();

        assertThrows(IllegalStateException.class, () -> portal.rename("Again"));
        assertEquals(2, portal.version());
    }
}
