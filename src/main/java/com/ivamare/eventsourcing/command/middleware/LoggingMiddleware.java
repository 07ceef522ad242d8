package com.ivamare.eventsourcing.command.middleware;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs command start, success and failure with timing.
 */
public class LoggingMiddleware implements CommandMiddleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public Object handle(Command command, Next next) throws Exception {
        long start = System.currentTimeMillis();
        log.info("Executing command {} (correlationId={})", command.type(), command.correlationId());
        try {
            Object result = next.proceed();
            log.info("Command {} succeeded in {}ms", command.type(), System.currentTimeMillis() - start);
            return result;
        } catch (Exception e) {
            log.warn("Command {} failed in {}ms: {}",
                command.type(), System.currentTimeMillis() - start, e.getMessage());
            throw e;
        }
    }
}
