package com.ivamare.eventsourcing.command;

import com.ivamare.eventsourcing.pipeline.Middleware;

/**
 * Middleware in the command pipeline.
 */
public interface CommandMiddleware extends Middleware<Command> {
}
