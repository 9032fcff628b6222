package com.ivamare.hostbridge.exception;

/**
 * Raised when a batched round trip to the host failed as a whole.
 *
 * <p>The same instance is delivered to every call that was part of the round trip,
 * since the failure cannot be attributed to one of them.
 */
public class TransportException extends HostBridgeException {

    private final int callCount;

    public TransportException(String message, int callCount, Throwable cause) {
        super(message, cause);
        this.callCount = callCount;
    }

    public int getCallCount() {
        return callCount;
    }
}
