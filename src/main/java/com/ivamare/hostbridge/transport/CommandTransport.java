package com.ivamare.hostbridge.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes one named command against the host process.
 *
 * <p>This is the seam to whatever IPC the host exposes. Implementations may fail either
 * by throwing from {@link #execute} or by completing the returned future exceptionally;
 * callers treat both the same way.
 *
 * <p>Besides the host's own commands, a transport used behind the batching invoker must
 * understand {@value #BATCH_INVOKE}:
 * <pre>
 * args:   {"calls": [{"id": "1", "cmd": "get_version", "args": {}}, ...]}
 * result: [{"id": "1", "status": "ok", "data": "1.0.0"},
 *          {"id": "2", "status": "error", "error": "not found"}, ...]
 * </pre>
 * with one result per call id, in any order.
 */
public interface CommandTransport {

    /**
     * Name of the aggregate command carrying several calls in one round trip.
     */
    String BATCH_INVOKE = "batch_invoke";

    /**
     * Argument key holding the calls of a {@value #BATCH_INVOKE}.
     */
    String CALLS_ARG = "calls";

    /**
     * Execute a command.
     *
     * @param command Command name
     * @param args Command arguments (never null)
     * @return future completing with the command result
     */
    CompletableFuture<Object> execute(String command, Map<String, Object> args);
}
