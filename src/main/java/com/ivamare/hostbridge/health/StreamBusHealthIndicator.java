package com.ivamare.hostbridge.health;

import com.ivamare.hostbridge.model.BackpressureStatus;
import com.ivamare.hostbridge.model.StreamBusStats;
import com.ivamare.hostbridge.stream.StreamBus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

/**
 * Health indicator for the stream bus.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP while the bus drains normally</li>
 *   <li>BACKPRESSURE while producers outpace the drain</li>
 *   <li>OUT_OF_SERVICE when the drain cadence is not running</li>
 * </ul>
 */
public class StreamBusHealthIndicator implements HealthIndicator {

    public static final Status BACKPRESSURE = new Status("BACKPRESSURE", "Stream bus is coalescing updates");

    private final StreamBus streamBus;

    public StreamBusHealthIndicator(StreamBus streamBus) {
        this.streamBus = streamBus;
    }

    @Override
    public Health health() {
        try {
            StreamBusStats stats = streamBus.getStats();
            BackpressureStatus backpressure = streamBus.getBackpressureStatus();

            Health.Builder builder;
            if (!streamBus.isRunning()) {
                builder = Health.outOfService();
            } else if (backpressure.active()) {
                builder = Health.status(BACKPRESSURE);
            } else {
                builder = Health.up();
            }

            return builder
                .withDetail("running", streamBus.isRunning())
                .withDetail("queueDepth", stats.queueDepth())
                .withDetail("subscribers", stats.subscriberCount())
                .withDetail("highWaterMark", backpressure.highWaterMark())
                .withDetail("deliveredUpdates", stats.deliveredUpdates())
                .withDetail("coalescedUpdates", stats.coalescedUpdates())
                .withDetail("droppedUpdates", stats.droppedUpdates())
                .withDetail("subscriberErrors", stats.subscriberErrors())
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
