package com.ivamare.hostbridge.handler;

import java.util.Map;

/**
 * Functional interface for in-process command handlers.
 *
 * <p>The return value becomes the command result. Any exception fails the command; its
 * message is reported to the caller.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Process a command.
     *
     * @param args Command arguments (never null)
     * @return the result (may be null)
     * @throws Exception on processing failure
     */
    Object handle(Map<String, Object> args) throws Exception;
}
