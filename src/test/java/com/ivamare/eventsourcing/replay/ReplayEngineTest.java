package com.ivamare.eventsourcing.replay;

import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.aggregate.PortalAggregate;
import com.ivamare.eventsourcing.dispatch.impl.DefaultEventDispatcher;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.notify.InProcessNotificationChannel;
import com.ivamare.eventsourcing.notify.NotificationTopics;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ReplayEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryEventStore store;
    private DefaultEventDispatcher dispatcher;
    private InProcessNotificationChannel channel;
    private AggregateFactories factories;
    private ReplayEngine engine;
    private List<DomainEvent> dispatched;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        channel = new InProcessNotificationChannel();
        dispatcher = new DefaultEventDispatcher(channel);
        factories = new AggregateFactories();
        factories.register(PortalAggregate.TYPE, PortalAggregate::new);
        engine = new ReplayEngine(store, dispatcher, channel, factories, 100, 0, 50, 5);
        dispatched = new CopyOnWriteArrayList<>();
        channel.subscribe(NotificationTopics.DOMAIN_EVENT, (topic, payload) -> dispatched.add((DomainEvent) payload));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void append(String aggregateId, String eventType, long version, String name, Instant at) {
        store.append(List.of(DomainEvent.create(aggregateId, PortalAggregate.TYPE, eventType, version,
            Map.of("name", name), null).withTimestamp(at)));
    }

    private void seedPortal() {
        append("p-1", "PortalCreated", 1, "Home", T0);
        append("p-1", "PortalRenamed", 2, "Start", T0.plusSeconds(60));
        append("p-1", "PortalRenamed", 3, "End", T0.plusSeconds(120));
    }

    private ReplayProgress awaitFinished(String sessionId) {
        await().atMost(Duration.ofSeconds(5))
            .until(() -> engine.getActiveSessions().isEmpty() && engine.getProgress(sessionId).isPresent());
        return engine.getProgress(sessionId).orElseThrow();
    }

    private ReplayProgress awaitStatus(String sessionId, ReplayStatus status) {
        await().atMost(Duration.ofSeconds(5))
            .until(() -> engine.getProgress(sessionId).map(p -> p.status() == status).orElse(false));
        return engine.getProgress(sessionId).orElseThrow();
    }

    @Nested
    class SessionTests {

        @Test
        void shouldReplayFilteredEventsAndComplete() {
            seedPortal();
            append("p-2", "PortalCreated", 1, "Docs", T0.plusSeconds(30));
            List<Object> completed = new CopyOnWriteArrayList<>();
            channel.subscribe(NotificationTopics.REPLAY_COMPLETED, (topic, payload) -> completed.add(payload));

            String sessionId = engine.startReplay(ReplayOptions.builder()
                .eventTypes(List.of("PortalRenamed"))
                .build());

            ReplayProgress progress = awaitFinished(sessionId);
            assertEquals(ReplayStatus.COMPLETED, progress.status());
            assertTrue(sessionId.startsWith("replay-"));
            assertEquals(2, progress.totalEvents());
            assertEquals(2, progress.processedEvents());
            assertEquals(2, dispatched.size());
            assertEquals(1, completed.size());
            assertTrue(engine.getActiveSessions().isEmpty());
        }

        @Test
        void shouldNotDispatchInDryRun() {
            seedPortal();
            List<Object> progressEvents = new CopyOnWriteArrayList<>();
            channel.subscribe(NotificationTopics.REPLAY_PROGRESS, (topic, payload) -> progressEvents.add(payload));

            String sessionId = engine.startReplay(ReplayOptions.builder().dryRun(true).build());

            ReplayProgress progress = awaitFinished(sessionId);
            assertEquals(3, progress.processedEvents());
            assertTrue(dispatched.isEmpty());
            assertEquals(3, progressEvents.size());
            assertTrue(progress.elapsedMs() > 0);
            assertTrue(progress.eventsPerSecond() > 0);
            assertEquals(0, progress.estimatedRemainingMs());
        }

        @Test
        void shouldRecordHandlerErrorsAndContinue() {
            seedPortal();
            dispatcher.register("PortalRenamed", event -> {
                if ("Start".equals(event.payload().get("name"))) {
                    throw new IllegalStateException("read model offline");
                }
            });

            String sessionId = engine.startReplay(ReplayOptions.builder().build());

            ReplayProgress progress = awaitFinished(sessionId);
            assertEquals(3, progress.processedEvents());
            assertEquals(1, progress.errors().size());
            assertTrue(progress.errors().get(0).contains("read model offline"));
        }

        @Test
        void shouldNameExceptionWhenHandlerFailsWithoutMessage() {
            seedPortal();
            dispatcher.register("PortalCreated", event -> {
                throw new IllegalStateException();
            });

            String sessionId = engine.startReplay(ReplayOptions.builder().build());

            ReplayProgress progress = awaitFinished(sessionId);
            assertEquals(1, progress.errors().size());
            assertTrue(progress.errors().get(0).endsWith(": IllegalStateException"));
        }

        @Test
        void shouldKeepProgressReadableWhenSessionFailsWithoutMessage() {
            seedPortal();
            InProcessNotificationChannel failingChannel = new InProcessNotificationChannel() {
                @Override
                public void publish(String topic, Object payload) {
                    if (NotificationTopics.REPLAY_PROGRESS.equals(topic)) {
                        throw new IllegalStateException();
                    }
                    super.publish(topic, payload);
                }
            };
            ReplayEngine failingEngine = new ReplayEngine(store, dispatcher, failingChannel, factories, 100, 0, 50, 5);
            try {
                String sessionId = failingEngine.startReplay(ReplayOptions.builder().dryRun(true).build());

                await().atMost(Duration.ofSeconds(5))
                    .until(() -> failingEngine.getActiveSessions().isEmpty()
                        && failingEngine.getProgress(sessionId).isPresent());
                ReplayProgress progress = failingEngine.getProgress(sessionId).orElseThrow();

                assertEquals(ReplayStatus.ERROR, progress.status());
                assertEquals(List.of("IllegalStateException"), progress.errors());
            } finally {
                failingEngine.close();
            }
        }

        @Test
        void shouldPauseBetweenBatchesAndResume() throws Exception {
            seedPortal();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            dispatcher.register("PortalCreated", event -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
            });

            String sessionId = engine.startReplay(ReplayOptions.builder().batchSize(1).build());
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(engine.pauseReplay(sessionId));
            release.countDown();

            ReplayProgress paused = awaitStatus(sessionId, ReplayStatus.PAUSED);
            assertEquals(1, paused.processedEvents());

            assertTrue(engine.resumeReplay(sessionId));
            ReplayProgress completed = awaitFinished(sessionId);
            assertEquals(3, completed.processedEvents());
        }

        @Test
        void shouldDiscardStoppedSession() throws Exception {
            seedPortal();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            dispatcher.register("PortalCreated", event -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
            });
            List<Object> stopped = new CopyOnWriteArrayList<>();
            channel.subscribe(NotificationTopics.REPLAY_STOPPED, (topic, payload) -> stopped.add(payload));

            String sessionId = engine.startReplay(ReplayOptions.builder().build());
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(engine.stopReplay(sessionId));
            release.countDown();

            assertEquals(1, stopped.size());
            assertTrue(engine.getProgress(sessionId).isEmpty());
            assertFalse(engine.stopReplay(sessionId));
            Thread.sleep(50);
            assertEquals(1, dispatched.size());
        }

        @Test
        void shouldReturnFalseForUnknownSession() {
            assertFalse(engine.pauseReplay("replay-missing"));
            assertFalse(engine.resumeReplay("replay-missing"));
            assertTrue(engine.getProgress("replay-missing").isEmpty());
        }
    }

    @Nested
    class PacingTests {

        @Test
        void shouldScaleDelayBySpeedAndCap() {
            assertEquals(20, engine.pacedDelay(T0, T0.plusMillis(40), 2.0));
            assertEquals(50, engine.pacedDelay(T0, T0.plusSeconds(10), 1.0));
            assertEquals(0, engine.pacedDelay(T0.plusSeconds(1), T0, 1.0));
        }

        @Test
        void shouldDisablePacingWithoutSpeed() {
            assertFalse(ReplayOptions.builder().build().paced());
            assertFalse(ReplayOptions.builder().speed(0.0).build().paced());
            assertTrue(ReplayOptions.builder().speed(10.0).build().paced());
        }
    }

    @Nested
    class DirectOperationTests {

        @Test
        void shouldReplayAggregateUpToVersion() {
            seedPortal();

            List<DomainEvent> events = engine.replayAggregate("p-1", 2L, false);

            assertEquals(2, events.size());
            assertEquals(2, dispatched.size());
        }

        @Test
        void shouldSelectWithoutDispatchingInDryRun() {
            seedPortal();

            assertEquals(3, engine.replayAggregate("p-1", null, true).size());
            assertTrue(dispatched.isEmpty());
        }

        @Test
        void shouldCompareStreams() {
            append("a", "PortalCreated", 1, "Home", T0);
            append("a", "PortalRenamed", 2, "Start", T0);
            append("a", "PortalRenamed", 3, "End", T0);
            append("b", "PortalCreated", 1, "Home", T0);
            append("b", "PortalRenamed", 2, "Other", T0);

            StreamComparison comparison = engine.compareStreams("a", "b");

            assertEquals(1, comparison.matching());
            assertFalse(comparison.identical());
            assertEquals(List.of(
                new StreamDifference(2, "Payload mismatch"),
                new StreamDifference(3, "Missing in stream 2")), comparison.differences());
        }

        @Test
        void shouldReportEventTypeMismatch() {
            append("a", "PortalCreated", 1, "Home", T0);
            append("b", "PortalRenamed", 1, "Home", T0);

            StreamComparison comparison = engine.compareStreams("a", "b");

            assertEquals("Event type mismatch: PortalCreated vs PortalRenamed",
                comparison.differences().get(0).diff());
        }

        @Test
        void shouldTimeTravelWithReconstruction() {
            seedPortal();

            TimeTravelResult result = engine.timeTravel("p-1", PortalAggregate.TYPE, T0.plusSeconds(60));

            assertTrue(result.reconstructed());
            assertEquals(2, result.version());
            assertEquals(2, result.events().size());
            assertEquals("Start", result.state().get("name"));
        }

        @Test
        void shouldTimeTravelWithoutFactory() {
            seedPortal();

            TimeTravelResult result = engine.timeTravel("p-1", "Unregistered", T0.plusSeconds(90));

            assertFalse(result.reconstructed());
            assertEquals(2, result.version());
            assertTrue(result.state().isEmpty());
        }

        @Test
        void shouldReturnEmptyTimeTravelBeforeFirstEvent() {
            seedPortal();

            TimeTravelResult result = engine.timeTravel("p-1", T0.minusSeconds(1));

            assertEquals(0, result.version());
            assertTrue(result.events().isEmpty());
        }
    }
}
