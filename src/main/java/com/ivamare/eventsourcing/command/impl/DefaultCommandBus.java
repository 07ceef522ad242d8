package com.ivamare.eventsourcing.command.impl;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandBus;
import com.ivamare.eventsourcing.command.CommandHandler;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import com.ivamare.eventsourcing.exception.ValidationException;
import com.ivamare.eventsourcing.handler.HandlerRegistry;
import com.ivamare.eventsourcing.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventsourcing.pipeline.MiddlewareChain;
import com.ivamare.eventsourcing.pipeline.RequestMdc;
import com.ivamare.eventsourcing.pipeline.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Default implementation of CommandBus.
 */
public class DefaultCommandBus implements CommandBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandBus.class);

    private final HandlerRegistry<CommandHandler> handlers;
    private final MiddlewareChain<Command> chain = new MiddlewareChain<>();

    public DefaultCommandBus() {
        this(new DefaultHandlerRegistry<>("command"));
    }

    public DefaultCommandBus(HandlerRegistry<CommandHandler> handlers) {
        this.handlers = handlers;
    }

    @Override
    public void register(String commandType, Supplier<? extends CommandHandler> handlerFactory) {
        handlers.register(commandType, handlerFactory);
        log.info("Registered command handler for {}", commandType);
    }

    @Override
    public void use(CommandMiddleware middleware) {
        chain.add(middleware);
        log.debug("Added command middleware {}", middleware.getClass().getSimpleName());
    }

    @Override
    public Result<Object> execute(Command command) {
        long start = System.nanoTime();
        String correlationId = command != null && command.correlationId() != null
            ? command.correlationId()
            : UUID.randomUUID().toString();

        RequestMdc.put(correlationId, command != null ? command.type() : null);
        try {
            if (command == null) {
                throw new ValidationException("Command must not be null");
            }
            Command withId = command.correlationId() != null ? command : command.withCorrelationId(correlationId);
            Object data = chain.execute(withId, this::invokeHandler);
            return Result.success(data, correlationId, elapsedMs(start));
        } catch (Exception e) {
            log.warn("Command {} failed (correlationId={}): {}",
                command != null ? command.type() : null, correlationId, e.getMessage());
            return Result.failure(e, correlationId, elapsedMs(start));
        } finally {
            RequestMdc.clear();
        }
    }

    private Object invokeHandler(Command command) throws Exception {
        CommandHandler handler = handlers.getOrThrow(command.type());
        return handler.handle(command);
    }

    @Override
    public boolean hasHandler(String commandType) {
        return handlers.hasHandler(commandType);
    }

    @Override
    public List<String> registeredCommandTypes() {
        return handlers.registeredTypes();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
