package com.ivamare.eventsourcing.query;

/**
 * Handles one query type, typically by reading a projection.
 */
@FunctionalInterface
public interface QueryHandler {

    Object handle(Query query) throws Exception;
}
