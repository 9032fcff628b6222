package com.ivamare.hostbridge.exception;

/**
 * Thrown when attempting to register a handler for a command that already has one.
 */
public class HandlerAlreadyRegisteredException extends HostBridgeException {

    private final String command;

    public HandlerAlreadyRegisteredException(String command) {
        super("Handler already registered for " + command);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
