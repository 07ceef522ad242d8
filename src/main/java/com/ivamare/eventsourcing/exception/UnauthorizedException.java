package com.ivamare.eventsourcing.exception;

/**
 * Raised when a request lacks the actor identity it needs.
 */
public class UnauthorizedException extends EventSourcingException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
