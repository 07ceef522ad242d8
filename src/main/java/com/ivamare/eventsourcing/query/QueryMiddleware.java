package com.ivamare.eventsourcing.query;

import com.ivamare.eventsourcing.pipeline.Middleware;

/**
 * Middleware in the query pipeline.
 */
public interface QueryMiddleware extends Middleware<Query> {
}
