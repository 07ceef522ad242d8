package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no factory is registered for an aggregate type.
 */
public class AggregateFactoryNotFoundException extends EventSourcingException {

    private final String aggregateType;

    public AggregateFactoryNotFoundException(String aggregateType) {
        super("No factory registered for aggregate type: " + aggregateType);
        this.aggregateType = aggregateType;
    }

    public String getAggregateType() {
        return aggregateType;
    }
}
