package com.ivamare.eventsourcing.pipeline;

/**
 * Caller context carried by commands and queries.
 *
 * @param actorId       authenticated actor, null when anonymous
 * @param tenantId      tenant
 * @param correlationId correlation id, generated by the bus when absent
 * @param traceId       external trace id
 */
public record RequestMetadata(
    String actorId,
    String tenantId,
    String correlationId,
    String traceId
) {

    private static final RequestMetadata EMPTY = new RequestMetadata(null, null, null, null);

    public static RequestMetadata empty() {
        return EMPTY;
    }

    public static RequestMetadata forActor(String actorId) {
        return new RequestMetadata(actorId, null, null, null);
    }

    public RequestMetadata withCorrelationId(String correlationId) {
        return new RequestMetadata(actorId, tenantId, correlationId, traceId);
    }

    public boolean hasActor() {
        return actorId != null && !actorId.isBlank();
    }
}
