package com.ivamare.hostbridge.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ivamare.hostbridge.model.InvokerStats;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for calling host commands.
 *
 * <p>Calls issued close together are coalesced into as few transport round trips as
 * possible; each caller still gets exactly one outcome on its own future. Failures are
 * delivered as exceptional completion:
 * <ul>
 *   <li>{@link com.ivamare.hostbridge.exception.CommandFailedException} - the host
 *       reported an error for this call</li>
 *   <li>{@link com.ivamare.hostbridge.exception.TransportException} - the batched round
 *       trip carrying this call failed as a whole</li>
 *   <li>{@link com.ivamare.hostbridge.exception.MissingResultException} - the host
 *       answered the batch without a result for this call</li>
 *   <li>any other exception - a single unbatched call failed in the transport</li>
 * </ul>
 *
 * <p>No call is retried; only the caller knows whether a command is idempotent.
 */
public interface CommandInvoker extends AutoCloseable {

    /**
     * Invoke a command without arguments.
     *
     * @param command The command name (e.g., "get_version")
     * @return future completing with the raw command result
     */
    CompletableFuture<Object> invoke(String command);

    /**
     * Invoke a command.
     *
     * @param command The command name
     * @param args Command arguments (nullable, treated as empty)
     * @return future completing with the raw command result
     */
    CompletableFuture<Object> invoke(String command, Map<String, Object> args);

    /**
     * Invoke a command and convert its result.
     *
     * @param command The command name
     * @param args Command arguments (nullable)
     * @param resultType Type to convert the result to
     * @param <T> result type
     * @return future completing with the converted result
     */
    <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, Class<T> resultType);

    /**
     * Invoke a command and convert its result to a generic type.
     *
     * @param command The command name
     * @param args Command arguments (nullable)
     * @param resultType Type to convert the result to
     * @param <T> result type
     * @return future completing with the converted result
     */
    <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, TypeReference<T> resultType);

    /**
     * Dispatch whatever is queued now instead of waiting for the batch window.
     *
     * @return future completing once the round trip has settled; already complete when
     *     nothing was queued
     */
    CompletableFuture<Void> flush();

    /**
     * Discard queued calls and restart call ids. Intended for test isolation.
     */
    void resetState();

    InvokerStats getStats();

    /**
     * Flush pending calls and release the invoker's threads.
     */
    @Override
    void close();
}
