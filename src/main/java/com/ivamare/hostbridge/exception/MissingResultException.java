package com.ivamare.hostbridge.exception;

/**
 * Raised when a batch response carries no result for a call that was sent.
 */
public class MissingResultException extends HostBridgeException {

    private final String callId;
    private final String command;

    public MissingResultException(String callId, String command) {
        super("Missing result for call " + callId + " (" + command + ")");
        this.callId = callId;
        this.command = command;
    }

    public String getCallId() {
        return callId;
    }

    public String getCommand() {
        return command;
    }
}
