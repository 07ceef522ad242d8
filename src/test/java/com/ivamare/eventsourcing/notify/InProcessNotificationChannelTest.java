package com.ivamare.eventsourcing.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InProcessNotificationChannelTest {

    private InProcessNotificationChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InProcessNotificationChannel();
    }

    @Test
    void shouldDeliverToSubscribersOfTopic() {
        List<Object> received = new ArrayList<>();
        channel.subscribe("replay.progress", (topic, payload) -> received.add(payload));

        channel.publish("replay.progress", "p1");
        channel.publish("replay.completed", "ignored");

        assertEquals(List.of("p1"), received);
    }

    @Test
    void shouldIgnoreTopicWithoutSubscribers() {
        assertDoesNotThrow(() -> channel.publish("nobody", "payload"));
        assertEquals(0, channel.listenerCount("nobody"));
    }

    @Test
    void shouldKeepDeliveringWhenListenerFails() {
        List<Object> received = new ArrayList<>();
        channel.subscribe("domain.event", (topic, payload) -> {
            throw new IllegalStateException("listener down");
        });
        channel.subscribe("domain.event", (topic, payload) -> received.add(payload));

        channel.publish("domain.event", "e1");

        assertEquals(List.of("e1"), received);
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        List<Object> received = new ArrayList<>();
        NotificationListener listener = (topic, payload) -> received.add(payload);
        channel.subscribe("domain.event", listener);

        channel.unsubscribe("domain.event", listener);
        channel.publish("domain.event", "e1");

        assertTrue(received.isEmpty());
        assertEquals(0, channel.listenerCount("domain.event"));
    }

    @Test
    void shouldBuildEventTypeTopic() {
        assertEquals("event.PortalCreated", NotificationTopics.forEventType("PortalCreated"));
    }
}
