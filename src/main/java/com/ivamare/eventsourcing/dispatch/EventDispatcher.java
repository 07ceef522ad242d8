package com.ivamare.eventsourcing.dispatch;

import com.ivamare.eventsourcing.model.DomainEvent;

/**
 * Routes committed events to registered handlers and to the notification channel.
 */
public interface EventDispatcher {

    /**
     * Register a handler for an event type. Handlers run in registration order.
     */
    void register(String eventType, EventHandler handler);

    /**
     * Run every handler registered for the event's type synchronously, then publish
     * the event to its type topic and the catch-all topic.
     *
     * <p>The first handler failure aborts dispatch and propagates. Checked exceptions
     * are wrapped in {@link com.ivamare.eventsourcing.exception.EventDispatchException}.
     */
    void dispatch(DomainEvent event);

    int handlerCount(String eventType);
}
