package com.ivamare.eventsourcing.replay;

import com.ivamare.eventsourcing.model.DomainEvent;

/**
 * Payload of the replay lifecycle topics. {@code event} is set on progress only.
 */
public record ReplayNotification(
    String sessionId,
    DomainEvent event,
    ReplayProgress progress
) {
}
