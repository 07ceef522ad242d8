package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.aggregate.AggregateFactory;
import com.ivamare.eventsourcing.command.CommandBus;
import com.ivamare.eventsourcing.command.CommandHandler;
import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.dispatch.EventHandler;
import com.ivamare.eventsourcing.projection.Projection;
import com.ivamare.eventsourcing.projection.ProjectionRunner;
import com.ivamare.eventsourcing.query.QueryBus;
import com.ivamare.eventsourcing.query.QueryHandler;

import java.util.function.Supplier;

/**
 * Single registration point for handlers, projections and aggregate factories.
 */
public class EventSourcingRegistry {

    private final CommandBus commandBus;
    private final QueryBus queryBus;
    private final EventDispatcher eventDispatcher;
    private final ProjectionRunner projectionRunner;
    private final AggregateFactories aggregateFactories;

    public EventSourcingRegistry(CommandBus commandBus, QueryBus queryBus, EventDispatcher eventDispatcher,
                                 ProjectionRunner projectionRunner, AggregateFactories aggregateFactories) {
        this.commandBus = commandBus;
        this.queryBus = queryBus;
        this.eventDispatcher = eventDispatcher;
        this.projectionRunner = projectionRunner;
        this.aggregateFactories = aggregateFactories;
    }

    public EventSourcingRegistry registerCommandHandler(String commandType, Supplier<? extends CommandHandler> factory) {
        commandBus.register(commandType, factory);
        return this;
    }

    public EventSourcingRegistry registerQueryHandler(String queryType, Supplier<? extends QueryHandler> factory) {
        queryBus.register(queryType, factory);
        return this;
    }

    public EventSourcingRegistry registerEventHandler(String eventType, EventHandler handler) {
        eventDispatcher.register(eventType, handler);
        return this;
    }

    public EventSourcingRegistry registerProjection(Projection projection) {
        projectionRunner.register(projection);
        return this;
    }

    public EventSourcingRegistry registerAggregateFactory(String aggregateType, AggregateFactory<?> factory) {
        aggregateFactories.register(aggregateType, factory);
        return this;
    }
}
