package com.ivamare.eventsourcing.handler.impl;

import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Default implementation of HandlerRegistry.
 *
 * @param <H> handler type
 */
public class DefaultHandlerRegistry<H> implements HandlerRegistry<H> {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final String kind;
    private final Map<String, Supplier<? extends H>> factories = new ConcurrentHashMap<>();

    /**
     * @param kind request kind used in log and error messages, e.g. "command"
     */
    public DefaultHandlerRegistry(String kind) {
        this.kind = kind;
    }

    @Override
    public void register(String type, Supplier<? extends H> factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        if (factories.putIfAbsent(type, factory) != null) {
            throw new HandlerAlreadyRegisteredException(kind, type);
        }
        log.debug("Registered {} handler for {}", kind, type);
    }

    @Override
    public Optional<H> get(String type) {
        if (type == null) {
            return Optional.empty();
        }
        Supplier<? extends H> factory = factories.get(type);
        return factory == null ? Optional.empty() : Optional.ofNullable(factory.get());
    }

    @Override
    public H getOrThrow(String type) {
        return get(type).orElseThrow(() -> new HandlerNotFoundException(kind, type));
    }

    @Override
    public boolean hasHandler(String type) {
        return type != null && factories.containsKey(type);
    }

    @Override
    public List<String> registeredTypes() {
        return List.copyOf(factories.keySet());
    }

    @Override
    public void clear() {
        factories.clear();
    }
}
