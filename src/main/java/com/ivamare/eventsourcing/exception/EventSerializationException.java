package com.ivamare.eventsourcing.exception;

/**
 * Thrown when an event payload, metadata or snapshot state cannot be (de)serialized.
 */
public class EventSerializationException extends EventSourcingException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
