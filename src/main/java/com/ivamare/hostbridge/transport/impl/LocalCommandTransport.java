package com.ivamare.hostbridge.transport.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.hostbridge.handler.HandlerRegistry;
import com.ivamare.hostbridge.model.BatchResult;
import com.ivamare.hostbridge.model.Call;
import com.ivamare.hostbridge.transport.CommandTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * In-process transport dispatching commands to a {@link HandlerRegistry}.
 *
 * <p>Implements the host half of {@value CommandTransport#BATCH_INVOKE}: every call of a
 * batch is dispatched concurrently and the results come back in input order, one per
 * call. Calls without a registered handler are answered with an error result instead of
 * failing the batch.
 */
public class LocalCommandTransport implements CommandTransport {

    private static final Logger log = LoggerFactory.getLogger(LocalCommandTransport.class);
    private static final TypeReference<List<Call>> CALL_LIST = new TypeReference<>() {};

    private final HandlerRegistry handlerRegistry;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public LocalCommandTransport(HandlerRegistry handlerRegistry, ObjectMapper objectMapper) {
        this(handlerRegistry, objectMapper, ForkJoinPool.commonPool());
    }

    /**
     * Creates a new LocalCommandTransport.
     *
     * @param handlerRegistry Registry of command handlers
     * @param objectMapper Object mapper used to read batch calls
     * @param executor Executor running the handlers
     */
    public LocalCommandTransport(HandlerRegistry handlerRegistry, ObjectMapper objectMapper, Executor executor) {
        this.handlerRegistry = handlerRegistry;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Object> execute(String command, Map<String, Object> args) {
        Map<String, Object> safeArgs = args != null ? args : Map.of();

        if (BATCH_INVOKE.equals(command)) {
            List<Call> calls;
            try {
                calls = readCalls(safeArgs);
            } catch (IllegalArgumentException e) {
                return CompletableFuture.failedFuture(e);
            }
            return batchInvoke(calls);
        }

        return dispatch(command, safeArgs);
    }

    private CompletableFuture<Object> dispatch(String command, Map<String, Object> args) {
        CompletableFuture<Object> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(handlerRegistry.dispatch(command, args));
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private CompletableFuture<Object> batchInvoke(List<Call> calls) {
        log.debug("batch_invoke: dispatching {} calls", calls.size());

        List<CompletableFuture<BatchResult>> results = new ArrayList<>(calls.size());
        for (Call call : calls) {
            results.add(dispatchCall(call));
        }

        return CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<BatchResult> ordered = new ArrayList<>(results.size());
                for (CompletableFuture<BatchResult> result : results) {
                    ordered.add(result.join());
                }
                return ordered;
            });
    }

    private CompletableFuture<BatchResult> dispatchCall(Call call) {
        if (!handlerRegistry.hasHandler(call.command())) {
            return CompletableFuture.completedFuture(
                BatchResult.error(call.id(), "Unknown batch command: " + call.command()));
        }
        return dispatch(call.command(), call.args())
            .handle((data, error) -> error == null
                ? BatchResult.ok(call.id(), data)
                : BatchResult.error(call.id(), describe(error)));
    }

    private List<Call> readCalls(Map<String, Object> args) {
        Object raw = args.get(CALLS_ARG);
        if (raw == null) {
            return List.of();
        }
        return objectMapper.convertValue(raw, CALL_LIST);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
