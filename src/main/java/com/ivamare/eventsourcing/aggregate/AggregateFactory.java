package com.ivamare.eventsourcing.aggregate;

/**
 * Creates a blank aggregate instance for a given id.
 *
 * @param <A> aggregate type
 */
@FunctionalInterface
public interface AggregateFactory<A extends Aggregate> {

    A create(String aggregateId);
}
