package com.ivamare.hostbridge.stream;

import com.ivamare.hostbridge.model.UpdateEnvelope;

/**
 * Callback receiving envelopes released by the stream bus.
 *
 * <p>Called on the bus drain thread. Exceptions are logged and counted by the bus and
 * do not affect other subscribers.
 */
@FunctionalInterface
public interface UpdateSubscriber {

    void onUpdate(UpdateEnvelope envelope);
}
