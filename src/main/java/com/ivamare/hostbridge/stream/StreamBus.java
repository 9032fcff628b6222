package com.ivamare.hostbridge.stream;

import com.ivamare.hostbridge.model.BackpressureStatus;
import com.ivamare.hostbridge.model.StreamBusStats;
import com.ivamare.hostbridge.model.UpdateEnvelope;
import com.ivamare.hostbridge.stream.impl.DefaultStreamBus;

/**
 * Backpressure-aware bus delivering incremental updates from host tasks to UI subscribers.
 *
 * <p>Producers hand envelopes to {@link #queueUpdate}, which never blocks on subscribers.
 * Envelopes are released on a fixed drain cadence in priority-then-FIFO order, so bursts
 * reach subscribers as fewer, larger deliveries. Under backpressure, successive text and
 * progress envelopes for the same target are merged; terminal output, list mutations and
 * high-priority envelopes are always delivered one for one.
 *
 * <p>Inside a Spring application inject the {@code StreamBus} bean. Other code may use the
 * process-wide default instance:
 * <pre>
 * StreamBus bus = StreamBus.getInstance();
 * Subscription subscription = bus.subscribe(envelope -&gt; render(envelope));
 * bus.queueUpdate(UpdateEnvelopes.createTerminalUpdate("build ok\n"));
 * // ... later
 * subscription.unsubscribe();
 * </pre>
 */
public interface StreamBus {

    /**
     * Register a subscriber. It receives every envelope released after this call.
     *
     * @param subscriber The callback
     * @return handle used to unsubscribe
     */
    Subscription subscribe(UpdateSubscriber subscriber);

    /**
     * Queue an envelope for delivery on a later drain.
     *
     * @param envelope The envelope, built by {@link UpdateEnvelopes}
     */
    void queueUpdate(UpdateEnvelope envelope);

    /**
     * Release pending envelopes to subscribers now.
     *
     * <p>Runs automatically on the drain cadence once {@link #start()} was called. A drain
     * requested while another is running does nothing.
     *
     * @return number of envelopes released
     */
    int drain();

    StreamBusStats getStats();

    BackpressureStatus getBackpressureStatus();

    /**
     * Start draining on the configured cadence. Calling it on a running bus does nothing.
     */
    void start();

    boolean isRunning();

    /**
     * Stop draining, discard pending envelopes, remove all subscribers and reset counters.
     */
    void destroy();

    /**
     * Get the process-wide default bus, creating and starting it on first use. Inside a
     * Spring context this is the auto-configured bus bean.
     *
     * @return the default bus
     */
    static StreamBus getInstance() {
        return DefaultStreamBus.getInstance();
    }

    /**
     * Create a new bus builder.
     *
     * @return new builder instance
     */
    static StreamBusBuilder builder() {
        return new StreamBusBuilder();
    }
}
