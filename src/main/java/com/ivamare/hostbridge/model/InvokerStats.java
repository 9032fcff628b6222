package com.ivamare.hostbridge.model;

/**
 * Cumulative counters of a batching invoker.
 *
 * @param invocations Calls accepted through invoke
 * @param roundTrips Transport calls made, direct and batched
 * @param batchRoundTrips Transport calls that carried a batch_invoke
 * @param failedRoundTrips Transport calls that failed as a whole
 */
public record InvokerStats(
    long invocations,
    long roundTrips,
    long batchRoundTrips,
    long failedRoundTrips
) {
}
