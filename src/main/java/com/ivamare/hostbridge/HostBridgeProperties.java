package com.ivamare.hostbridge;

import com.ivamare.hostbridge.api.impl.BatchingCommandInvoker;
import com.ivamare.hostbridge.api.impl.CachingCommandInvoker;
import com.ivamare.hostbridge.stream.StreamBusBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Host Bridge.
 *
 * <p>Example configuration:
 * <pre>
 * hostbridge:
 *   enabled: true
 *   batch:
 *     window: 2ms
 *   stream:
 *     auto-start: true
 *     drain-interval: 16ms
 *     high-water-mark: 256
 *     max-queue-size: 10000
 *     max-updates-per-drain: 1000
 *   cache:
 *     enabled: true
 *     max-size: 200
 *     ttls:
 *       "[settings_load]": 30s
 *       "[get_version]": 0
 *     invalidation:
 *       "[settings:changed]": [settings_load, settings_get]
 * </pre>
 */
@ConfigurationProperties(prefix = "hostbridge")
public class HostBridgeProperties {

    /**
     * Enable/disable Host Bridge auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Request batching configuration.
     */
    private BatchProperties batch = new BatchProperties();

    /**
     * Stream bus configuration.
     */
    private StreamProperties stream = new StreamProperties();

    /**
     * Response cache configuration.
     */
    private CacheProperties cache = new CacheProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public BatchProperties getBatch() {
        return batch;
    }

    public void setBatch(BatchProperties batch) {
        this.batch = batch;
    }

    public StreamProperties getStream() {
        return stream;
    }

    public void setStream(StreamProperties stream) {
        this.stream = stream;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    /**
     * Request batching configuration properties.
     */
    public static class BatchProperties {

        /**
         * Time a batch stays open after its first call.
         */
        private Duration window = BatchingCommandInvoker.DEFAULT_BATCH_WINDOW;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    /**
     * Stream bus configuration properties.
     */
    public static class StreamProperties {

        /**
         * Start the drain cadence when the bus bean is created.
         */
        private boolean autoStart = true;

        /**
         * Interval between drains.
         */
        private Duration drainInterval = StreamBusBuilder.DEFAULT_DRAIN_INTERVAL;

        /**
         * Queue depth above which backpressure turns on. It turns off again at half this depth.
         */
        private int highWaterMark = StreamBusBuilder.DEFAULT_HIGH_WATER_MARK;

        /**
         * Queue depth at which low-priority mergeable updates are dropped.
         */
        private int maxQueueSize = StreamBusBuilder.DEFAULT_MAX_QUEUE_SIZE;

        /**
         * Maximum updates released by one drain.
         */
        private int maxUpdatesPerDrain = StreamBusBuilder.DEFAULT_MAX_UPDATES_PER_DRAIN;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getDrainInterval() {
            return drainInterval;
        }

        public void setDrainInterval(Duration drainInterval) {
            this.drainInterval = drainInterval;
        }

        public int getHighWaterMark() {
            return highWaterMark;
        }

        public void setHighWaterMark(int highWaterMark) {
            this.highWaterMark = highWaterMark;
        }

        public int getMaxQueueSize() {
            return maxQueueSize;
        }

        public void setMaxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
        }

        public int getMaxUpdatesPerDrain() {
            return maxUpdatesPerDrain;
        }

        public void setMaxUpdatesPerDrain(int maxUpdatesPerDrain) {
            this.maxUpdatesPerDrain = maxUpdatesPerDrain;
        }
    }

    /**
     * Response cache configuration properties.
     */
    public static class CacheProperties {

        /**
         * Wrap the invoker in a response cache.
         */
        private boolean enabled = false;

        /**
         * Maximum cached entries; least recently used entries are evicted first.
         */
        private int maxSize = CachingCommandInvoker.DEFAULT_MAX_SIZE;

        /**
         * Time-to-live per cacheable command. Zero keeps entries until invalidated.
         */
        private Map<String, Duration> ttls = new HashMap<>(Map.of(
            "settings_load", Duration.ofSeconds(30),
            "settings_get", Duration.ofSeconds(30),
            "get_version", Duration.ZERO,
            "get_extensions", Duration.ofSeconds(60),
            "get_enabled_extensions", Duration.ofSeconds(60),
            "list_available_themes", Duration.ofSeconds(120),
            "load_keybindings_file", Duration.ofSeconds(60),
            "get_default_keybindings", Duration.ZERO
        ));

        /**
         * Commands invalidated per host event name.
         */
        private Map<String, List<String>> invalidation = new HashMap<>(Map.of(
            "settings:changed", List.of("settings_load", "settings_get"),
            "extension:installed", List.of("get_extensions", "get_enabled_extensions"),
            "extension:uninstalled", List.of("get_extensions", "get_enabled_extensions"),
            "extension:enabled", List.of("get_enabled_extensions"),
            "extension:disabled", List.of("get_enabled_extensions")
        ));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Map<String, Duration> getTtls() {
            return ttls;
        }

        public void setTtls(Map<String, Duration> ttls) {
            this.ttls = ttls;
        }

        public Map<String, List<String>> getInvalidation() {
            return invalidation;
        }

        public void setInvalidation(Map<String, List<String>> invalidation) {
            this.invalidation = invalidation;
        }
    }
}
