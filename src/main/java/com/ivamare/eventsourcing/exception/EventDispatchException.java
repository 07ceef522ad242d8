package com.ivamare.eventsourcing.exception;

/**
 * Wraps a checked exception thrown by an event handler during dispatch.
 */
public class EventDispatchException extends EventSourcingException {

    private final String eventType;
    private final String eventId;

    public EventDispatchException(String eventType, String eventId, Throwable cause) {
        super("Event handler failed for " + eventType + " (eventId=" + eventId + "): " + cause.getMessage(), cause);
        this.eventType = eventType;
        this.eventId = eventId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventId() {
        return eventId;
    }
}
