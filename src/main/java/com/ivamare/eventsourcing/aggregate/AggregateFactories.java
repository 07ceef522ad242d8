package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.exception.AggregateFactoryNotFoundException;
import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of aggregate factories keyed by aggregate type.
 */
public class AggregateFactories {

    private static final Logger log = LoggerFactory.getLogger(AggregateFactories.class);

    private final Map<String, AggregateFactory<?>> factories = new ConcurrentHashMap<>();

    public void register(String aggregateType, AggregateFactory<?> factory) {
        if (factories.putIfAbsent(aggregateType, factory) != null) {
            throw new HandlerAlreadyRegisteredException("aggregate", aggregateType);
        }
        log.debug("Registered aggregate factory for {}", aggregateType);
    }

    public Optional<AggregateFactory<?>> get(String aggregateType) {
        return Optional.ofNullable(factories.get(aggregateType));
    }

    public boolean contains(String aggregateType) {
        return factories.containsKey(aggregateType);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Create a blank aggregate.
     *
     * @throws AggregateFactoryNotFoundException if the type is not registered
     */
    public Aggregate create(String aggregateType, String aggregateId) {
        AggregateFactory<?> factory = factories.get(aggregateType);
        if (factory == null) {
            throw new AggregateFactoryNotFoundException(aggregateType);
        }
        return factory.create(aggregateId);
    }
}
