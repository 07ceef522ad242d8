package com.ivamare.eventsourcing.command.middleware;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import com.ivamare.eventsourcing.exception.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rejects malformed commands before they reach the handler.
 *
 * <p>Every command must carry a type. Per-type validators may add further checks.
 */
public class ValidationMiddleware implements CommandMiddleware {

    /**
     * Returns the violations of a command, empty when valid.
     */
    @FunctionalInterface
    public interface CommandValidator {

        List<String> validate(Command command);
    }

    private final Map<String, CommandValidator> validators = new ConcurrentHashMap<>();

    public ValidationMiddleware register(String commandType, CommandValidator validator) {
        validators.put(commandType, validator);
        return this;
    }

    @Override
    public Object handle(Command command, Next next) throws Exception {
        if (command.type() == null || command.type().isBlank()) {
            throw new ValidationException("Command type is required");
        }
        CommandValidator validator = validators.get(command.type());
        if (validator != null) {
            List<String> violations = validator.validate(command);
            if (violations != null && !violations.isEmpty()) {
                throw new ValidationException("Invalid " + command.type() + ": " + String.join("; ", violations));
            }
        }
        return next.proceed();
    }
}
