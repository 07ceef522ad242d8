package com.ivamare.eventsourcing.dispatch.impl;

import com.ivamare.eventsourcing.exception.EventDispatchException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.notify.NotificationChannel;
import com.ivamare.eventsourcing.notify.NotificationTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultEventDispatcherTest {

    @Mock
    private NotificationChannel notificationChannel;

    private DefaultEventDispatcher dispatcher;
    private DomainEvent event;

    @BeforeEach
    void setUp() {
        dispatcher = new DefaultEventDispatcher(notificationChannel);
        event = DomainEvent.create("p-1", "Portal", "PortalCreated", 1, Map.of("name", "Home"), null);
    }

    @Test
    void shouldInvokeHandlersInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        dispatcher.register("PortalCreated", e -> calls.add("first"));
        dispatcher.register("PortalCreated", e -> calls.add("second"));
        dispatcher.register("PortalDeleted", e -> calls.add("other"));

        dispatcher.dispatch(event);

        assertEquals(List.of("first", "second"), calls);
        assertEquals(2, dispatcher.handlerCount("PortalCreated"));
    }

    @Test
    void shouldPublishTypedTopicThenDomainEventTopic() {
        dispatcher.dispatch(event);

        InOrder order = inOrder(notificationChannel);
        order.verify(notificationChannel).publish("event.PortalCreated", event);
        order.verify(notificationChannel).publish(NotificationTopics.DOMAIN_EVENT, event);
    }

    @Test
    void shouldPublishWithoutHandlers() {
        dispatcher.dispatch(event);

        assertEquals(0, dispatcher.handlerCount("PortalCreated"));
        verify(notificationChannel, times(2)).publish(anyString(), eq(event));
    }

    @Test
    void shouldPropagateRuntimeExceptionAndStop() {
        List<String> calls = new ArrayList<>();
        dispatcher.register("PortalCreated", e -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.register("PortalCreated", e -> calls.add("second"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(event));

        assertEquals("boom", ex.getMessage());
        assertTrue(calls.isEmpty());
        verifyNoInteractions(notificationChannel);
    }

    @Test
    void shouldWrapCheckedException() {
        dispatcher.register("PortalCreated", e -> {
            throw new IOException("disk");
        });

        EventDispatchException ex = assertThrows(EventDispatchException.class, () -> dispatcher.dispatch(event));

        assertInstanceOf(IOException.class, ex.getCause());
    }
}
