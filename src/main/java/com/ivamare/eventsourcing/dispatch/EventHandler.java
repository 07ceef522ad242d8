package com.ivamare.eventsourcing.dispatch;

import com.ivamare.eventsourcing.model.DomainEvent;

/**
 * In-process reaction to a committed domain event.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event) throws Exception;
}
