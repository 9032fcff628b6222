package com.ivamare.hostbridge.stream;

import com.ivamare.hostbridge.stream.impl.DefaultStreamBus;

import java.time.Duration;

/**
 * Builder for creating StreamBus instances.
 */
public class StreamBusBuilder {

    public static final Duration DEFAULT_DRAIN_INTERVAL = Duration.ofMillis(16);
    public static final int DEFAULT_HIGH_WATER_MARK = 256;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 10_000;
    public static final int DEFAULT_MAX_UPDATES_PER_DRAIN = 1_000;

    private Duration drainInterval = DEFAULT_DRAIN_INTERVAL;
    private int highWaterMark = DEFAULT_HIGH_WATER_MARK;
    private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
    private int maxUpdatesPerDrain = DEFAULT_MAX_UPDATES_PER_DRAIN;

    /**
     * Set the drain cadence (default: 16ms, about one frame).
     *
     * @param drainInterval Interval between drains
     * @return this builder
     */
    public StreamBusBuilder drainInterval(Duration drainInterval) {
        this.drainInterval = drainInterval;
        return this;
    }

    /**
     * Set the queue depth above which backpressure turns on (default: 256).
     *
     * @param highWaterMark Depth threshold
     * @return this builder
     */
    public StreamBusBuilder highWaterMark(int highWaterMark) {
        this.highWaterMark = highWaterMark;
        return this;
    }

    /**
     * Set the depth at which droppable envelopes are discarded (default: 10000).
     *
     * @param maxQueueSize Queue capacity for droppable envelopes
     * @return this builder
     */
    public StreamBusBuilder maxQueueSize(int maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
        return this;
    }

    /**
     * Set how many envelopes one drain releases at most (default: 1000).
     *
     * @param maxUpdatesPerDrain Per-drain release limit
     * @return this builder
     */
    public StreamBusBuilder maxUpdatesPerDrain(int maxUpdatesPerDrain) {
        this.maxUpdatesPerDrain = maxUpdatesPerDrain;
        return this;
    }

    /**
     * Build the bus. The bus is not started.
     *
     * @return configured StreamBus
     * @throws IllegalStateException if a setting is out of range
     */
    public StreamBus build() {
        if (drainInterval == null || drainInterval.isZero() || drainInterval.isNegative()) {
            throw new IllegalStateException("drainInterval must be positive");
        }
        if (highWaterMark < 1) {
            throw new IllegalStateException("highWaterMark must be positive");
        }
        if (maxQueueSize <= highWaterMark) {
            throw new IllegalStateException("maxQueueSize must be greater than highWaterMark");
        }
        if (maxUpdatesPerDrain < 1) {
            throw new IllegalStateException("maxUpdatesPerDrain must be positive");
        }

        return new DefaultStreamBus(drainInterval, highWaterMark, maxQueueSize, maxUpdatesPerDrain);
    }
}
