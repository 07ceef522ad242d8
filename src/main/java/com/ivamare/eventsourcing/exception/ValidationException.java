package com.ivamare.eventsourcing.exception;

/**
 * Raised for malformed commands or queries. Reported in the result envelope.
 */
public class ValidationException extends EventSourcingException {

    public ValidationException(String message) {
        super(message);
    }
}
