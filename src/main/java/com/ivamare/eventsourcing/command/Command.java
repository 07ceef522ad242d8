package com.ivamare.eventsourcing.command;

import com.ivamare.eventsourcing.pipeline.RequestMetadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A request to change state, routed to exactly one handler by {@link #type()}.
 *
 * <p>Type, data and metadata are immutable. Attributes are a mutable side channel that
 * middlewares use to hand context (such as the transaction status) to the handler.
 */
public final class Command {

    private final String type;
    private final Map<String, Object> data;
    private final RequestMetadata metadata;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    public Command(String type, Map<String, Object> data, RequestMetadata metadata) {
        this(type, data, metadata, Instant.now(), new ConcurrentHashMap<>());
    }

    private Command(String type, Map<String, Object> data, RequestMetadata metadata,
                    Instant timestamp, Map<String, Object> attributes) {
        this.type = type;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.metadata = metadata == null ? RequestMetadata.empty() : metadata;
        this.timestamp = timestamp;
        this.attributes = attributes;
    }

    public static Command of(String type, Map<String, Object> data) {
        return new Command(type, data, RequestMetadata.empty());
    }

    public String type() {
        return type;
    }

    public Map<String, Object> data() {
        return data;
    }

    public RequestMetadata metadata() {
        return metadata;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String correlationId() {
        return metadata.correlationId();
    }

    /**
     * Copy with the given correlation id. Attributes are shared with the copy.
     */
    public Command withCorrelationId(String correlationId) {
        return new Command(type, data, metadata.withCorrelationId(correlationId), timestamp, attributes);
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getAttribute(String name) {
        return Optional.ofNullable((T) attributes.get(name));
    }

    public void removeAttribute(String name) {
        attributes.remove(name);
    }

    @Override
    public String toString() {
        return "Command{type=" + type + ", correlationId=" + metadata.correlationId() + "}";
    }
}
