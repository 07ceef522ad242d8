package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Registry mapping a request type to a handler factory.
 *
 * <p>The factory is invoked on every lookup, so handlers may be stateful per request.
 *
 * @param <H> handler type
 */
public interface HandlerRegistry<H> {

    /**
     * Register a handler factory.
     *
     * @param type    request type
     * @param factory creates the handler per request
     * @throws HandlerAlreadyRegisteredException if already registered
     */
    void register(String type, Supplier<? extends H> factory);

    /**
     * Create the handler for a type.
     *
     * @param type request type
     * @return handler, or empty if not registered
     */
    Optional<H> get(String type);

    /**
     * Create the handler for a type, throwing if not found.
     *
     * @throws HandlerNotFoundException if not registered
     */
    H getOrThrow(String type);

    boolean hasHandler(String type);

    List<String> registeredTypes();

    /**
     * Clear all registered handlers. Mainly for testing.
     */
    void clear();
}
