package com.ivamare.eventsourcing.dispatch.impl;

import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.dispatch.EventHandler;
import com.ivamare.eventsourcing.exception.EventDispatchException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.notify.NotificationChannel;
import com.ivamare.eventsourcing.notify.NotificationTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default implementation of EventDispatcher.
 */
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventDispatcher.class);

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final NotificationChannel notificationChannel;

    public DefaultEventDispatcher(NotificationChannel notificationChannel) {
        this.notificationChannel = notificationChannel;
    }

    @Override
    public void register(String eventType, EventHandler handler) {
        handlers.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Registered event handler for {}", eventType);
    }

    @Override
    public void dispatch(DomainEvent event) {
        List<EventHandler> registered = handlers.getOrDefault(event.eventType(), List.of());
        log.debug("Dispatching {} (eventId={}, aggregateId={}) to {} handlers",
            event.eventType(), event.eventId(), event.aggregateId(), registered.size());

        for (EventHandler handler : registered) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new EventDispatchException(event.eventType(), event.eventId(), e);
            }
        }

        notificationChannel.publish(NotificationTopics.forEventType(event.eventType()), event);
        notificationChannel.publish(NotificationTopics.DOMAIN_EVENT, event);
    }

    @Override
    public int handlerCount(String eventType) {
        return handlers.getOrDefault(eventType, List.of()).size();
    }
}
