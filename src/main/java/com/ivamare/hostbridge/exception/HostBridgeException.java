package com.ivamare.hostbridge.exception;

/**
 * Base exception for all Host Bridge errors.
 */
public class HostBridgeException extends RuntimeException {

    public HostBridgeException(String message) {
        super(message);
    }

    public HostBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
