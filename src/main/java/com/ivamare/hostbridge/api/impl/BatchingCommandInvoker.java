package com.ivamare.hostbridge.api.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.hostbridge.api.CommandInvoker;
import com.ivamare.hostbridge.exception.CommandFailedException;
import com.ivamare.hostbridge.exception.MissingResultException;
import com.ivamare.hostbridge.exception.TransportException;
import com.ivamare.hostbridge.model.BatchResult;
import com.ivamare.hostbridge.model.Call;
import com.ivamare.hostbridge.model.InvokerStats;
import com.ivamare.hostbridge.transport.CommandTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Invoker coalescing calls issued within a short window into one transport round trip.
 *
 * <p>The first call of a batch schedules a flush one batch window later; every call made
 * before that flush joins the same batch. A batch of one is sent as a plain command, a
 * larger batch as a single {@value CommandTransport#BATCH_INVOKE} whose results are
 * matched back to their callers by call id.
 */
public class BatchingCommandInvoker implements CommandInvoker {

    private static final Logger log = LoggerFactory.getLogger(BatchingCommandInvoker.class);
    private static final TypeReference<List<BatchResult>> RESULT_LIST = new TypeReference<>() {};

    public static final Duration DEFAULT_BATCH_WINDOW = Duration.ofMillis(2);

    private final CommandTransport transport;
    private final ObjectMapper objectMapper;
    private final Duration batchWindow;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final AtomicLong invocations = new AtomicLong(0);
    private final AtomicLong roundTrips = new AtomicLong(0);
    private final AtomicLong batchRoundTrips = new AtomicLong(0);
    private final AtomicLong failedRoundTrips = new AtomicLong(0);

    private final Object lock = new Object();

    // guarded by lock
    private List<PendingCall> queue = new ArrayList<>();
    private ScheduledFuture<?> scheduledFlush;
    private long lastCallId;
    private boolean closed;

    public BatchingCommandInvoker(CommandTransport transport, ObjectMapper objectMapper) {
        this(transport, objectMapper, DEFAULT_BATCH_WINDOW);
    }

    public BatchingCommandInvoker(CommandTransport transport, ObjectMapper objectMapper, Duration batchWindow) {
        this(transport, objectMapper, batchWindow, newScheduler(), true);
    }

    /**
     * Creates a new BatchingCommandInvoker on a caller-owned scheduler.
     *
     * @param transport Transport executing the commands
     * @param objectMapper Object mapper for batch results and typed conversion
     * @param batchWindow Time a batch stays open after its first call
     * @param scheduler Scheduler running the automatic flush (not shut down by close)
     */
    public BatchingCommandInvoker(
            CommandTransport transport,
            ObjectMapper objectMapper,
            Duration batchWindow,
            ScheduledExecutorService scheduler) {
        this(transport, objectMapper, batchWindow, scheduler, false);
    }

    private BatchingCommandInvoker(
            CommandTransport transport,
            ObjectMapper objectMapper,
            Duration batchWindow,
            ScheduledExecutorService scheduler,
            boolean ownsScheduler) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.batchWindow = Objects.requireNonNull(batchWindow, "batchWindow");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        if (batchWindow.isNegative()) {
            throw new IllegalArgumentException("batchWindow must not be negative");
        }
    }

    // --- Invocation ---

    @Override
    public CompletableFuture<Object> invoke(String command) {
        return invoke(command, null);
    }

    @Override
    public CompletableFuture<Object> invoke(String command, Map<String, Object> args) {
        Objects.requireNonNull(command, "command");

        PendingCall pending;
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Invoker is closed"));
            }
            if (scheduledFlush == null) {
                try {
                    scheduledFlush = scheduler.schedule(this::flushOnSchedule, batchWindow.toNanos(), TimeUnit.NANOSECONDS);
                } catch (RejectedExecutionException e) {
                    log.warn("Scheduler rejected the flush of a new batch, failing {}", command);
                    return CompletableFuture.failedFuture(e);
                }
            }
            pending = new PendingCall(new Call(String.valueOf(++lastCallId), command, args));
            queue.add(pending);
        }

        invocations.incrementAndGet();
        return pending.future;
    }

    @Override
    public <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, Class<T> resultType) {
        return invoke(command, args).thenApply(result -> objectMapper.convertValue(result, resultType));
    }

    @Override
    public <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, TypeReference<T> resultType) {
        return invoke(command, args).thenApply(result -> objectMapper.convertValue(result, resultType));
    }

    // --- Flush ---

    @Override
    public CompletableFuture<Void> flush() {
        List<PendingCall> batch;
        synchronized (lock) {
            batch = queue;
            queue = new ArrayList<>();
            cancelScheduledFlush();
        }

        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        if (batch.size() == 1) {
            return dispatchSingle(batch.get(0));
        }
        return dispatchBatch(batch);
    }

    private void flushOnSchedule() {
        try {
            flush();
        } catch (Exception e) {
            log.error("Scheduled flush failed", e);
        }
    }

    private CompletableFuture<Void> dispatchSingle(PendingCall pending) {
        Call call = pending.call;
        roundTrips.incrementAndGet();

        return send(call.command(), call.args()).handle((result, error) -> {
            if (error != null) {
                failedRoundTrips.incrementAndGet();
                pending.future.completeExceptionally(unwrap(error));
            } else {
                pending.future.complete(result);
            }
            return null;
        });
    }

    private CompletableFuture<Void> dispatchBatch(List<PendingCall> batch) {
        List<Call> calls = new ArrayList<>(batch.size());
        for (PendingCall pending : batch) {
            calls.add(pending.call);
        }
        roundTrips.incrementAndGet();
        batchRoundTrips.incrementAndGet();
        log.debug("Sending {} calls as one {}", calls.size(), CommandTransport.BATCH_INVOKE);

        Map<String, Object> args = Map.of(CommandTransport.CALLS_ARG, calls);
        return send(CommandTransport.BATCH_INVOKE, args).handle((response, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                failAll(batch, new TransportException(
                    CommandTransport.BATCH_INVOKE + " failed: " + cause.getMessage(), batch.size(), cause));
                return null;
            }

            List<BatchResult> results;
            try {
                results = readResults(response);
            } catch (IllegalArgumentException e) {
                failAll(batch, new TransportException(
                    "Unreadable " + CommandTransport.BATCH_INVOKE + " response: " + e.getMessage(), batch.size(), e));
                return null;
            }

            resolve(batch, results);
            return null;
        });
    }

    private void resolve(List<PendingCall> batch, List<BatchResult> results) {
        Map<String, BatchResult> byId = new HashMap<>();
        for (BatchResult result : results) {
            if (result != null && result.id() != null) {
                byId.putIfAbsent(result.id(), result);
            }
        }

        for (PendingCall pending : batch) {
            Call call = pending.call;
            BatchResult result = byId.get(call.id());
            if (result == null) {
                log.warn("{} response has no result for call {} ({})",
                    CommandTransport.BATCH_INVOKE, call.id(), call.command());
                pending.future.completeExceptionally(new MissingResultException(call.id(), call.command()));
            } else if (result.isOk()) {
                pending.future.complete(result.data());
            } else {
                String message = result.error() != null ? result.error() : "Unknown error";
                pending.future.completeExceptionally(new CommandFailedException(call.command(), message));
            }
        }
    }

    private void failAll(List<PendingCall> batch, TransportException error) {
        failedRoundTrips.incrementAndGet();
        log.warn("{} round trip with {} calls failed: {}",
            CommandTransport.BATCH_INVOKE, batch.size(), error.getMessage());
        for (PendingCall pending : batch) {
            pending.future.completeExceptionally(error);
        }
    }

    private List<BatchResult> readResults(Object response) {
        if (response == null) {
            throw new IllegalArgumentException("no results");
        }
        return objectMapper.convertValue(response, RESULT_LIST);
    }

    private CompletableFuture<Object> send(String command, Map<String, Object> args) {
        try {
            CompletableFuture<Object> response = transport.execute(command, args);
            if (response == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Transport returned no future for " + command));
            }
            return response;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    // --- State ---

    @Override
    public void resetState() {
        List<PendingCall> discarded;
        synchronized (lock) {
            discarded = queue;
            queue = new ArrayList<>();
            cancelScheduledFlush();
            lastCallId = 0;
        }
        for (PendingCall pending : discarded) {
            pending.future.cancel(false);
        }

        invocations.set(0);
        roundTrips.set(0);
        batchRoundTrips.set(0);
        failedRoundTrips.set(0);

        if (!discarded.isEmpty()) {
            log.debug("Reset invoker, cancelled {} queued calls", discarded.size());
        }
    }

    @Override
    public InvokerStats getStats() {
        return new InvokerStats(
            invocations.get(),
            roundTrips.get(),
            batchRoundTrips.get(),
            failedRoundTrips.get()
        );
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        flush();

        if (ownsScheduler) {
            scheduler.shutdown();
        }
        log.info("Closed command invoker (roundTrips={}, invocations={})", roundTrips.get(), invocations.get());
    }

    private void cancelScheduledFlush() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel(false);
            scheduledFlush = null;
        }
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "hostbridge-batch-flush");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static final class PendingCall {

        private final Call call;
        private final CompletableFuture<Object> future = new CompletableFuture<>();

        private PendingCall(Call call) {
            this.call = call;
        }
    }
}
