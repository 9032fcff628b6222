package com.ivamare.hostbridge.model;

/**
 * Backpressure state of the stream bus, exposed so producers can self-throttle.
 *
 * @param active Whether the bus is currently coalescing and dropping
 * @param queueDepth Envelopes currently pending
 * @param highWaterMark Depth above which backpressure turns on
 * @param lowWaterMark Depth at or below which a drain turns it off again
 * @param coalescedCount Envelopes merged so far
 * @param droppedCount Envelopes dropped so far
 */
public record BackpressureStatus(
    boolean active,
    int queueDepth,
    int highWaterMark,
    int lowWaterMark,
    long coalescedCount,
    long droppedCount
) {
}
