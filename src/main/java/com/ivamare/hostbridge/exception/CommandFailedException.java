package com.ivamare.hostbridge.exception;

/**
 * Raised on the caller of a single command when the host reported an error for that command.
 *
 * <p>Only the caller whose call failed sees this exception; other calls in the same
 * batch are unaffected.
 */
public class CommandFailedException extends HostBridgeException {

    private final String command;
    private final String errorMessage;

    public CommandFailedException(String command, String message) {
        super(command + " failed: " + message);
        this.command = command;
        this.errorMessage = message;
    }

    public String getCommand() {
        return command;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
