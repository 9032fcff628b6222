package com.ivamare.hostbridge.exception;

/**
 * Thrown when no handler is registered for a command.
 */
public class HandlerNotFoundException extends HostBridgeException {

    private final String command;

    public HandlerNotFoundException(String command) {
        super("No handler registered for " + command);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
