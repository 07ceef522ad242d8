package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no handler is registered for a command or query type.
 */
public class HandlerNotFoundException extends EventSourcingException {

    private final String kind;
    private final String type;

    public HandlerNotFoundException(String kind, String type) {
        super("No handler registered for " + kind + ": " + type);
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
