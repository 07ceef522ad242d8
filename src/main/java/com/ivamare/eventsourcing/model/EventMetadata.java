package com.ivamare.eventsourcing.model;

/**
 * Optional context attached to a domain event.
 *
 * @param actorId       who caused the event
 * @param tenantId      owning tenant
 * @param correlationId request correlation id
 * @param causationId   id of the command or event that caused this one
 * @param source        emitting component
 */
public record EventMetadata(
    String actorId,
    String tenantId,
    String correlationId,
    String causationId,
    String source
) {

    private static final EventMetadata EMPTY = new EventMetadata(null, null, null, null, null);

    public static EventMetadata empty() {
        return EMPTY;
    }

    public static EventMetadata ofCorrelation(String correlationId) {
        return new EventMetadata(null, null, correlationId, null, null);
    }

    public EventMetadata withCausationId(String causationId) {
        return new EventMetadata(actorId, tenantId, correlationId, causationId, source);
    }
}
