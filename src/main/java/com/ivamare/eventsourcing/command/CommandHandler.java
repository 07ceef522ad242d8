package com.ivamare.eventsourcing.command;

/**
 * Handles one command type.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param command the command
     * @return result placed in the envelope's data
     * @throws Exception on failure, reported as a failed result
     */
    Object handle(Command command) throws Exception;
}
