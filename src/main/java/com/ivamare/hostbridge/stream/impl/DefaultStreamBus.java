package com.ivamare.hostbridge.stream.impl;

import com.ivamare.hostbridge.model.BackpressureStatus;
import com.ivamare.hostbridge.model.StreamBusStats;
import com.ivamare.hostbridge.model.UpdateEnvelope;
import com.ivamare.hostbridge.model.UpdatePriority;
import com.ivamare.hostbridge.stream.StreamBus;
import com.ivamare.hostbridge.stream.StreamBusBuilder;
import com.ivamare.hostbridge.stream.Subscription;
import com.ivamare.hostbridge.stream.UpdateSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default stream bus: one FIFO lane per priority, drained on a single daemon thread.
 *
 * <p>Queue state is guarded by one lock. Subscribers are called outside that lock, so a
 * subscriber may queue updates or unsubscribe from inside its callback.
 */
public class DefaultStreamBus implements StreamBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultStreamBus.class);

    private static final Object INSTANCE_LOCK = new Object();
    private static StreamBus instance;

    private final Duration drainInterval;
    private final int highWaterMark;
    private final int lowWaterMark;
    private final int maxQueueSize;
    private final int maxUpdatesPerDrain;

    private final Object lock = new Object();
    private final Map<UpdatePriority, List<UpdateEnvelope>> lanes = new EnumMap<>(UpdatePriority.class);
    private final List<SubscriptionHandle> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong subscriptionSequence = new AtomicLong(0);

    private final AtomicLong totalUpdates = new AtomicLong(0);
    private final AtomicLong deliveredUpdates = new AtomicLong(0);
    private final AtomicLong coalescedUpdates = new AtomicLong(0);
    private final AtomicLong droppedUpdates = new AtomicLong(0);
    private final AtomicLong subscriberErrors = new AtomicLong(0);
    private final AtomicLong drainCount = new AtomicLong(0);

    // guarded by lock
    private int depth;
    private boolean backpressureActive;
    private ScheduledExecutorService scheduler;
    private long generation;

    /**
     * Creates a new DefaultStreamBus. Prefer {@link StreamBus#builder()}, which validates
     * the settings.
     *
     * @param drainInterval Interval between drains once started
     * @param highWaterMark Depth above which backpressure turns on
     * @param maxQueueSize Depth at which droppable envelopes are discarded
     * @param maxUpdatesPerDrain Maximum envelopes released by one drain
     */
    public DefaultStreamBus(Duration drainInterval, int highWaterMark, int maxQueueSize, int maxUpdatesPerDrain) {
        this.drainInterval = drainInterval;
        this.highWaterMark = highWaterMark;
        this.lowWaterMark = highWaterMark / 2;
        this.maxQueueSize = maxQueueSize;
        this.maxUpdatesPerDrain = maxUpdatesPerDrain;
        for (UpdatePriority priority : UpdatePriority.values()) {
            lanes.put(priority, new ArrayList<>());
        }
    }

    /**
     * Get the process-wide default bus, creating and starting it on first use.
     *
     * @return the default bus
     */
    public static StreamBus getInstance() {
        synchronized (INSTANCE_LOCK) {
            if (instance == null) {
                instance = new DefaultStreamBus(
                    StreamBusBuilder.DEFAULT_DRAIN_INTERVAL,
                    StreamBusBuilder.DEFAULT_HIGH_WATER_MARK,
                    StreamBusBuilder.DEFAULT_MAX_QUEUE_SIZE,
                    StreamBusBuilder.DEFAULT_MAX_UPDATES_PER_DRAIN
                );
                instance.start();
            }
            return instance;
        }
    }

    /**
     * Make the given bus the process-wide default returned by {@link #getInstance()}.
     * A different bus previously created by {@link #getInstance()} is destroyed. The slot
     * is cleared again when the given bus is destroyed.
     *
     * @param bus The bus to publish
     */
    public static void setInstance(DefaultStreamBus bus) {
        Objects.requireNonNull(bus, "bus");
        StreamBus previous;
        synchronized (INSTANCE_LOCK) {
            previous = instance;
            instance = bus;
        }
        if (previous != null && previous != bus) {
            log.info("Replacing default stream bus");
            previous.destroy();
        }
    }

    // --- Subscriptions ---

    @Override
    public Subscription subscribe(UpdateSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        SubscriptionHandle handle = new SubscriptionHandle(
            "sub-" + subscriptionSequence.incrementAndGet(), subscriber);
        subscribers.add(handle);
        log.debug("Added stream subscriber {} ({} active)", handle.id, subscribers.size());
        return handle;
    }

    // --- Producer side ---

    @Override
    public void queueUpdate(UpdateEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        synchronized (lock) {
            totalUpdates.incrementAndGet();

            if (backpressureActive && envelope.isCoalescible() && tryCoalesce(envelope)) {
                coalescedUpdates.incrementAndGet();
                return;
            }

            if (depth >= maxQueueSize && isDroppable(envelope)) {
                long dropped = droppedUpdates.incrementAndGet();
                log.debug("Dropped {} update {} for {} at capacity (dropped={})",
                    envelope.type(), envelope.id(), envelope.targetId(), dropped);
                return;
            }

            lanes.get(envelope.priority()).add(envelope);
            depth++;

            if (!backpressureActive && depth > highWaterMark) {
                backpressureActive = true;
                log.warn("Stream bus backpressure on (depth={}, highWaterMark={})", depth, highWaterMark);
            }
        }
    }

    /**
     * Merge into the latest pending envelope for the same target in the same lane.
     * Stops at the first envelope for that target: if it cannot absorb the new one,
     * merging further back would move content past it.
     */
    private boolean tryCoalesce(UpdateEnvelope envelope) {
        List<UpdateEnvelope> lane = lanes.get(envelope.priority());
        for (int i = lane.size() - 1; i >= 0; i--) {
            UpdateEnvelope pending = lane.get(i);
            if (!envelope.targetId().equals(pending.targetId())) {
                continue;
            }
            Optional<UpdateEnvelope> merged = pending.coalesce(envelope);
            if (merged.isPresent()) {
                lane.set(i, merged.get());
                return true;
            }
            return false;
        }
        return false;
    }

    private boolean isDroppable(UpdateEnvelope envelope) {
        return envelope.priority() == UpdatePriority.LOW && envelope.isCoalescible();
    }

    // --- Drain ---

    @Override
    public int drain() {
        if (!draining.compareAndSet(false, true)) {
            return 0;
        }
        try {
            List<UpdateEnvelope> released;
            long drainGeneration;
            synchronized (lock) {
                drainGeneration = generation;
                released = takeReleasable();
                drainCount.incrementAndGet();
                if (backpressureActive && depth <= lowWaterMark) {
                    backpressureActive = false;
                    log.info("Stream bus backpressure off (depth={}, coalesced={}, dropped={})",
                        depth, coalescedUpdates.get(), droppedUpdates.get());
                }
            }

            for (UpdateEnvelope envelope : released) {
                dispatch(envelope, drainGeneration);
            }
            countIfCurrent(deliveredUpdates, released.size(), drainGeneration);

            if (!released.isEmpty()) {
                log.debug("Drained {} updates to {} subscribers", released.size(), subscribers.size());
            }
            return released.size();
        } finally {
            draining.set(false);
        }
    }

    private List<UpdateEnvelope> takeReleasable() {
        List<UpdateEnvelope> released = new ArrayList<>();
        for (UpdatePriority priority : UpdatePriority.values()) {
            int remaining = maxUpdatesPerDrain - released.size();
            if (remaining == 0) {
                break;
            }
            List<UpdateEnvelope> lane = lanes.get(priority);
            List<UpdateEnvelope> head = lane.subList(0, Math.min(remaining, lane.size()));
            released.addAll(head);
            depth -= head.size();
            head.clear();
        }
        return released;
    }

    private void dispatch(UpdateEnvelope envelope, long drainGeneration) {
        for (SubscriptionHandle handle : subscribers) {
            if (!handle.isActive()) {
                continue;
            }
            try {
                handle.subscriber.onUpdate(envelope);
            } catch (Exception e) {
                countIfCurrent(subscriberErrors, 1, drainGeneration);
                log.warn("Stream subscriber {} failed on {} update {}",
                    handle.id, envelope.type(), envelope.id(), e);
            }
        }
    }

    /**
     * Add to a counter unless the bus was destroyed since the drain took its envelopes.
     */
    private void countIfCurrent(AtomicLong counter, long delta, long drainGeneration) {
        synchronized (lock) {
            if (generation == drainGeneration) {
                counter.addAndGet(delta);
            }
        }
    }

    private void drainOnSchedule() {
        try {
            drain();
        } catch (Exception e) {
            // keep the schedule alive; a thrown exception would cancel it
            log.error("Stream bus drain failed", e);
        }
    }

    // --- Observability ---

    @Override
    public StreamBusStats getStats() {
        int currentDepth;
        synchronized (lock) {
            currentDepth = depth;
        }
        return new StreamBusStats(
            totalUpdates.get(),
            deliveredUpdates.get(),
            coalescedUpdates.get(),
            droppedUpdates.get(),
            subscriberErrors.get(),
            drainCount.get(),
            subscribers.size(),
            currentDepth
        );
    }

    @Override
    public BackpressureStatus getBackpressureStatus() {
        synchronized (lock) {
            return new BackpressureStatus(
                backpressureActive,
                depth,
                highWaterMark,
                lowWaterMark,
                coalescedUpdates.get(),
                droppedUpdates.get()
            );
        }
    }

    // --- Lifecycle ---

    @Override
    public void start() {
        synchronized (lock) {
            if (scheduler != null) {
                log.warn("Stream bus already running");
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "hostbridge-stream-drain");
                thread.setDaemon(true);
                return thread;
            });
            long intervalNanos = drainInterval.toNanos();
            scheduler.scheduleAtFixedRate(this::drainOnSchedule, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        }
        log.info("Started stream bus (drainInterval={}ms, highWaterMark={}, maxQueueSize={})",
            drainInterval.toMillis(), highWaterMark, maxQueueSize);
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return scheduler != null;
        }
    }

    @Override
    public void destroy() {
        int discarded;
        synchronized (lock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
            discarded = depth;
            lanes.values().forEach(List::clear);
            depth = 0;
            backpressureActive = false;
            generation++;

            totalUpdates.set(0);
            deliveredUpdates.set(0);
            coalescedUpdates.set(0);
            droppedUpdates.set(0);
            subscriberErrors.set(0);
            drainCount.set(0);
        }

        int removed = subscribers.size();
        for (SubscriptionHandle handle : subscribers) {
            handle.active.set(false);
        }
        subscribers.clear();

        synchronized (INSTANCE_LOCK) {
            if (instance == this) {
                instance = null;
            }
        }

        log.info("Destroyed stream bus (discarded={}, subscribersRemoved={})", discarded, removed);
    }

    private final class SubscriptionHandle implements Subscription {

        private final String id;
        private final UpdateSubscriber subscriber;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private SubscriptionHandle(String id, UpdateSubscriber subscriber) {
            this.id = id;
            this.subscriber = subscriber;
        }

        @Override
        public void unsubscribe() {
            if (active.getAndSet(false)) {
                subscribers.remove(this);
                log.debug("Removed stream subscriber {} ({} active)", id, subscribers.size());
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
