package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable fact recorded against an aggregate at a specific version.
 *
 * <p>{@code position} is the global store position assigned on append. Events that
 * have not been stored yet carry {@link #UNASSIGNED}.
 *
 * @param eventId       unique event id
 * @param aggregateId   owning aggregate
 * @param aggregateType aggregate type name
 * @param eventType     event type name
 * @param version       aggregate version, starting at 1
 * @param timestamp     when the event occurred
 * @param payload       event data
 * @param metadata      optional context
 * @param position      global store position
 */
public record DomainEvent(
    String eventId,
    String aggregateId,
    String aggregateType,
    String eventType,
    long version,
    Instant timestamp,
    Map<String, Object> payload,
    EventMetadata metadata,
    long position
) {

    public static final long UNASSIGNED = 0L;

    public DomainEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(timestamp, "timestamp");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = metadata == null ? EventMetadata.empty() : metadata;
    }

    /**
     * Create a new, not yet stored event with a random id and the current timestamp.
     */
    public static DomainEvent create(String aggregateId, String aggregateType, String eventType,
                                     long version, Map<String, Object> payload, EventMetadata metadata) {
        return new DomainEvent(
            UUID.randomUUID().toString(),
            aggregateId,
            aggregateType,
            eventType,
            version,
            Instant.now(),
            payload,
            metadata,
            UNASSIGNED
        );
    }

    public DomainEvent withPosition(long position) {
        return new DomainEvent(eventId, aggregateId, aggregateType, eventType, version,
            timestamp, payload, metadata, position);
    }

    public DomainEvent withTimestamp(Instant timestamp) {
        return new DomainEvent(eventId, aggregateId, aggregateType, eventType, version,
            timestamp, payload, metadata, position);
    }
}
