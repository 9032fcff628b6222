package com.ivamare.hostbridge.stream;

/**
 * Handle of a stream bus subscription.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Stop receiving envelopes. Takes effect immediately, including for envelopes
     * already queued or being dispatched. Calling it more than once is harmless.
     */
    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
