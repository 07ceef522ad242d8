package com.ivamare.eventsourcing.exception;

/**
 * Thrown when an appended event does not carry the next version of its aggregate.
 *
 * <p>Signals a genuine write race: another writer committed first. The caller must
 * reload the aggregate and re-resolve the command; this exception is never retried
 * by the built-in retry middleware.
 */
public class ConcurrencyConflictException extends EventSourcingException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        this(aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion,
                                        Throwable cause) {
        super("Concurrency conflict for aggregate " + aggregateId
            + ": expected version " + expectedVersion + ", got " + actualVersion, cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
