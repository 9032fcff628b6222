package com.ivamare.hostbridge.api.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.hostbridge.api.CommandInvoker;
import com.ivamare.hostbridge.model.InvokerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Invoker decorator caching results of read-only commands.
 *
 * <p>Only commands with a configured time-to-live are cached. Entries are keyed by command
 * name and canonical JSON of the arguments, so argument order does not matter. A zero or
 * negative time-to-live keeps the entry until it is invalidated or evicted. Failed calls
 * are never cached.
 *
 * <p>Results are held as JSON trees and every cache hit gets its own copy, so callers may
 * modify what they receive. A result whose call was still in flight when its command was
 * invalidated is returned to its caller but not stored.
 */
public class CachingCommandInvoker implements CommandInvoker {

    private static final Logger log = LoggerFactory.getLogger(CachingCommandInvoker.class);

    public static final int DEFAULT_MAX_SIZE = 200;

    private final CommandInvoker delegate;
    private final ObjectMapper objectMapper;
    private final ObjectMapper keyMapper;
    private final Map<String, Duration> ttls;
    private final Map<String, List<String>> invalidations;
    private final int maxSize;
    private final Clock clock;

    // guarded by itself; access order for LRU eviction
    private final LinkedHashMap<String, CacheEntry> entries;

    // guarded by entries; bumped by invalidation
    private final Map<String, Long> commandGenerations = new HashMap<>();
    private long clearGeneration;

    public CachingCommandInvoker(
            CommandInvoker delegate,
            ObjectMapper objectMapper,
            Map<String, Duration> ttls,
            Map<String, List<String>> invalidations,
            int maxSize) {
        this(delegate, objectMapper, ttls, invalidations, maxSize, Clock.systemUTC());
    }

    /**
     * Creates a new CachingCommandInvoker.
     *
     * @param delegate Invoker performing uncached calls
     * @param objectMapper Object mapper for cache keys and typed conversion
     * @param ttls Time-to-live per cacheable command
     * @param invalidations Commands to invalidate per event name
     * @param maxSize Maximum number of cached entries
     * @param clock Clock deciding expiry
     */
    public CachingCommandInvoker(
            CommandInvoker delegate,
            ObjectMapper objectMapper,
            Map<String, Duration> ttls,
            Map<String, List<String>> invalidations,
            int maxSize,
            Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.keyMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.ttls = ttls != null ? Map.copyOf(ttls) : Map.of();
        this.invalidations = invalidations != null ? Map.copyOf(invalidations) : Map.of();
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > CachingCommandInvoker.this.maxSize;
            }
        };
    }

    @Override
    public CompletableFuture<Object> invoke(String command) {
        return invoke(command, null, false);
    }

    @Override
    public CompletableFuture<Object> invoke(String command, Map<String, Object> args) {
        return invoke(command, args, false);
    }

    /**
     * Invoke a command, optionally skipping the cache.
     *
     * @param command The command name
     * @param args Command arguments (nullable)
     * @param bypassCache Skip lookup and store for this call
     * @return future completing with the raw command result
     */
    public CompletableFuture<Object> invoke(String command, Map<String, Object> args, boolean bypassCache) {
        Objects.requireNonNull(command, "command");

        Duration ttl = ttls.get(command);
        if (ttl == null || bypassCache) {
            return delegate.invoke(command, args);
        }

        String key;
        try {
            key = cacheKey(command, args);
        } catch (JsonProcessingException e) {
            log.debug("Arguments of {} have no JSON form, not caching: {}", command, e.getMessage());
            return delegate.invoke(command, args);
        }

        Instant now = clock.instant();
        JsonNode cached = null;
        long startGeneration;
        synchronized (entries) {
            startGeneration = generation(command);
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                if (!entry.isExpired(now)) {
                    cached = entry.value;
                } else {
                    entries.remove(key);
                }
            }
        }
        if (cached != null) {
            return CompletableFuture.completedFuture(objectMapper.convertValue(cached, Object.class));
        }

        CompletableFuture<Object> result = new CompletableFuture<>();
        delegate.invoke(command, args).whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            store(command, key, value, ttl, startGeneration);
            result.complete(value);
        });
        return result;
    }

    @Override
    public <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, Class<T> resultType) {
        return invoke(command, args).thenApply(result -> objectMapper.convertValue(result, resultType));
    }

    @Override
    public <T> CompletableFuture<T> invoke(String command, Map<String, Object> args, TypeReference<T> resultType) {
        return invoke(command, args).thenApply(result -> objectMapper.convertValue(result, resultType));
    }

    // --- Invalidation ---

    /**
     * Remove every cached entry of a command.
     *
     * @param command The command name
     */
    public void invalidate(String command) {
        String prefix = command + ":";
        synchronized (entries) {
            entries.keySet().removeIf(key -> key.equals(command) || key.startsWith(prefix));
            commandGenerations.merge(command, 1L, Long::sum);
        }
    }

    public void invalidateAll() {
        synchronized (entries) {
            entries.clear();
            clearGeneration++;
        }
    }

    /**
     * Invalidate the commands mapped to a host event.
     *
     * @param eventName The event name (e.g., "settings:changed")
     */
    public void onEvent(String eventName) {
        List<String> commands = invalidations.getOrDefault(eventName, List.of());
        for (String command : commands) {
            invalidate(command);
        }
        if (!commands.isEmpty()) {
            log.debug("Event {} invalidated {}", eventName, commands);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    // --- Delegation ---

    @Override
    public CompletableFuture<Void> flush() {
        return delegate.flush();
    }

    @Override
    public void resetState() {
        invalidateAll();
        delegate.resetState();
    }

    @Override
    public InvokerStats getStats() {
        return delegate.getStats();
    }

    @Override
    public void close() {
        invalidateAll();
        delegate.close();
    }

    private void store(String command, String key, Object value, Duration ttl, long startGeneration) {
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.debug("Result of {} has no JSON form, not caching: {}", command, e.getMessage());
            return;
        }
        Instant expiresAt = ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        synchronized (entries) {
            if (generation(command) != startGeneration) {
                log.debug("{} was invalidated while in flight, not caching its result", command);
                return;
            }
            entries.put(key, new CacheEntry(tree, expiresAt));
        }
    }

    // caller holds entries
    private long generation(String command) {
        return clearGeneration + commandGenerations.getOrDefault(command, 0L);
    }

    private String cacheKey(String command, Map<String, Object> args) throws JsonProcessingException {
        if (args == null || args.isEmpty()) {
            return command;
        }
        return command + ":" + keyMapper.writeValueAsString(args);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record CacheEntry(JsonNode value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
