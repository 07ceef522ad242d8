package com.ivamare.eventsourcing.store;

import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class EventSubscriptionTest {

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
    }

    private void append(String aggregateId, long version) {
        store.append(List.of(DomainEvent.create(aggregateId, "Portal", "PortalRenamed", version, Map.of(), null)));
    }

    @Test
    void shouldYieldEventsInPositionOrder() {
        append("p-1", 1);
        append("p-2", 1);
        append("p-1", 2);

        try (EventSubscription subscription = store.subscribe(0, 2, Duration.ofMillis(10))) {
            assertEquals(1, subscription.next().position());
            assertEquals(2, subscription.next().position());
            assertEquals(3, subscription.next().position());
            assertEquals(3, subscription.position());
        }
    }

    @Test
    void shouldResumeFromPosition() {
        append("p-1", 1);
        append("p-1", 2);

        try (EventSubscription subscription = store.subscribe(1)) {
            DomainEvent event = subscription.next();
            assertEquals(2, event.version());
        }
    }

    @Test
    void shouldTimeOutPollWhenNoEvents() {
        try (EventSubscription subscription = store.subscribe(0, 10, Duration.ofMillis(5))) {
            assertTrue(subscription.poll(Duration.ofMillis(30)).isEmpty());
        }
    }

    @Test
    void shouldSeeEventsAppendedLater() throws Exception {
        try (EventSubscription subscription = store.subscribe(0, 10, Duration.ofMillis(5))) {
            CompletableFuture<Optional<DomainEvent>> next =
                CompletableFuture.supplyAsync(() -> subscription.poll(Duration.ofSeconds(5)));

            append("p-1", 1);

            assertEquals("p-1", next.get(5, TimeUnit.SECONDS).orElseThrow().aggregateId());
        }
    }

    @Test
    void shouldStopIteratingWhenClosed() {
        EventSubscription subscription = store.subscribe(0, 10, Duration.ofMillis(5));
        subscription.close();

        assertTrue(subscription.isClosed());
        assertFalse(subscription.hasNext());
        assertThrows(NoSuchElementException.class, subscription::next);
    }

    @Test
    void shouldEndIterationCleanlyWhenClosedFromAnotherThread() throws Exception {
        for (int i = 1; i <= 20_000; i++) {
            append("p-1", i);
        }
        EventSubscription subscription = store.subscribe(0, 50, Duration.ofMillis(5));
        AtomicLong consumed = new AtomicLong();

        CompletableFuture<Void> consumer = CompletableFuture.runAsync(() -> {
            while (subscription.hasNext()) {
                subscription.next();
                consumed.incrementAndGet();
            }
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> consumed.get() > 100);

        subscription.close();

        assertDoesNotThrow(() -> consumer.get(5, TimeUnit.SECONDS));
        assertTrue(subscription.isClosed());
        assertEquals(consumed.get(), subscription.position());
    }

    @Test
    void shouldRejectInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class,
            () -> new EventSubscription(store, 0, 0, Duration.ofMillis(5)));
    }
}
