package com.ivamare.eventsourcing.exception;

/**
 * Thrown when attempting to register a duplicate handler.
 */
public class HandlerAlreadyRegisteredException extends EventSourcingException {

    private final String kind;
    private final String type;

    public HandlerAlreadyRegisteredException(String kind, String type) {
        super("Handler already registered for " + kind + ": " + type);
        this.kind = kind;
        this.type = type;
    }

    public String getKind() {
        return kind;
    }

    public String getType() {
        return type;
    }
}
