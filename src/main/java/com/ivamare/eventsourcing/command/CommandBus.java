package com.ivamare.eventsourcing.command;

import com.ivamare.eventsourcing.pipeline.Result;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for state-changing requests.
 */
public interface CommandBus {

    /**
     * Register a handler factory for a command type.
     *
     * @throws com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException if already registered
     */
    void register(String commandType, Supplier<? extends CommandHandler> handlerFactory);

    /**
     * Append a middleware. Registration order is execution order, outermost first.
     */
    void use(CommandMiddleware middleware);

    /**
     * Execute a command through the middleware pipeline.
     *
     * <p>Never throws: every failure, including a missing handler, is reported as a
     * failed result. A correlation id is generated when the command carries none.
     */
    Result<Object> execute(Command command);

    boolean hasHandler(String commandType);

    List<String> registeredCommandTypes();
}
