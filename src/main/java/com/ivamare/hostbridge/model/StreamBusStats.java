package com.ivamare.hostbridge.model;

/**
 * Snapshot of stream bus counters. Counters are cumulative since creation or the last destroy.
 *
 * @param totalUpdates Envelopes ever passed to queueUpdate
 * @param deliveredUpdates Envelopes released by drains
 * @param coalescedUpdates Envelopes merged into a pending envelope
 * @param droppedUpdates Envelopes discarded at capacity
 * @param subscriberErrors Subscriber callbacks that threw
 * @param drainCount Drains that ran
 * @param subscriberCount Currently active subscriptions
 * @param queueDepth Envelopes currently pending
 */
public record StreamBusStats(
    long totalUpdates,
    long deliveredUpdates,
    long coalescedUpdates,
    long droppedUpdates,
    long subscriberErrors,
    long drainCount,
    int subscriberCount,
    int queueDepth
) {
}
