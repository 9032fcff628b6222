package com.ivamare.hostbridge.api.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.hostbridge.api.CommandInvoker;
import com.ivamare.hostbridge.exception.CommandFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingCommandInvokerTest {

    @Mock
    private CommandInvoker delegate;

    private MutableClock clock;
    private CachingCommandInvoker invoker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        invoker = new CachingCommandInvoker(
            delegate,
            new ObjectMapper(),
            Map.of(
                "settings_load", Duration.ofSeconds(30),
                "get_version", Duration.ZERO,
                "get_extensions", Duration.ofSeconds(60)
            ),
            Map.of("settings:changed", List.of("settings_load")),
            2,
            clock
        );
    }

    private static CompletableFuture<Object> respond(Object value) {
        return CompletableFuture.completedFuture(value);
    }

    private static Object await(CompletableFuture<?> future) throws Exception {
        return future.get(1, TimeUnit.SECONDS);
    }

    @Nested
    class LookupTests {

        @Test
        @DisplayName("should serve a repeated call from the cache")
        void shouldServeRepeatedCallFromCache() throws Exception {
            when(delegate.invoke("settings_load", null)).thenReturn(respond(Map.of("theme", "dark")));

            assertEquals(Map.of("theme", "dark"), await(invoker.invoke("settings_load")));
            assertEquals(Map.of("theme", "dark"), await(invoker.invoke("settings_load")));

            verify(delegate, times(1)).invoke("settings_load", null);
            assertEquals(1, invoker.size());
        }

        @Test
        @DisplayName("should hand every caller its own copy of a cached result")
        @SuppressWarnings("unchecked")
        void shouldHandOutIndependentCopies() throws Exception {
            Map<String, Object> loaded = new LinkedHashMap<>();
            loaded.put("theme", "dark");
            loaded.put("recent", new ArrayList<>(List.of("a.txt")));
            when(delegate.invoke("settings_load", null)).thenReturn(respond(loaded));

            Map<String, Object> first = (Map<String, Object>) await(invoker.invoke("settings_load"));
            first.put("theme", "light");
            Map<String, Object> second = (Map<String, Object>) await(invoker.invoke("settings_load"));
            ((List<Object>) second.get("recent")).add("b.txt");
            Map<String, Object> third = (Map<String, Object>) await(invoker.invoke("settings_load"));

            assertEquals(Map.of("theme", "dark", "recent", List.of("a.txt")), third);
            verify(delegate, times(1)).invoke("settings_load", null);
        }

        @Test
        @DisplayName("should treat argument maps with the same entries as one key")
        void shouldIgnoreArgumentOrder() throws Exception {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("a", 1);
            first.put("b", 2);
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("b", 2);
            second.put("a", 1);
            when(delegate.invoke("get_extensions", first)).thenReturn(respond(List.of("git")));

            await(invoker.invoke("get_extensions", first));
            assertEquals(List.of("git"), await(invoker.invoke("get_extensions", second)));

            verify(delegate, times(1)).invoke(eq("get_extensions"), anyMap());
        }

        @Test
        @DisplayName("should cache calls with different arguments separately")
        void shouldCacheDifferentArgumentsSeparately() throws Exception {
            when(delegate.invoke("get_extensions", Map.of("page", 1))).thenReturn(respond("one"));
            when(delegate.invoke("get_extensions", Map.of("page", 2))).thenReturn(respond("two"));

            assertEquals("one", await(invoker.invoke("get_extensions", Map.of("page", 1))));
            assertEquals("two", await(invoker.invoke("get_extensions", Map.of("page", 2))));
            assertEquals(2, invoker.size());
        }

        @Test
        @DisplayName("should not cache commands without a time-to-live")
        void shouldNotCacheUnknownCommands() throws Exception {
            when(delegate.invoke("save_file", Map.of("path", "a.txt"))).thenReturn(respond(true));

            await(invoker.invoke("save_file", Map.of("path", "a.txt")));
            await(invoker.invoke("save_file", Map.of("path", "a.txt")));

            verify(delegate, times(2)).invoke("save_file", Map.of("path", "a.txt"));
            assertEquals(0, invoker.size());
        }

        @Test
        @DisplayName("should skip the cache when bypass is requested")
        void shouldSkipCacheOnBypass() throws Exception {
            when(delegate.invoke("settings_load", null)).thenReturn(respond("fresh"));

            await(invoker.invoke("settings_load", null, true));
            await(invoker.invoke("settings_load", null, true));

            verify(delegate, times(2)).invoke("settings_load", null);
            assertEquals(0, invoker.size());
        }

        @Test
        @DisplayName("should not cache failed calls")
        void shouldNotCacheFailures() throws Exception {
            CommandFailedException failure = new CommandFailedException("settings_load", "locked");
            when(delegate.invoke("settings_load", null))
                .thenReturn(CompletableFuture.failedFuture(failure), respond("ok"));

            ExecutionException ex = assertThrows(ExecutionException.class, () -> await(invoker.invoke("settings_load")));
            assertSame(failure, ex.getCause());
            assertEquals("ok", await(invoker.invoke("settings_load")));
        }
    }

    @Nested
    class ExpiryTests {

        @Test
        @DisplayName("should call again once the time-to-live has passed")
        void shouldExpireAfterTtl() throws Exception {
            when(delegate.invoke("settings_load", null)).thenReturn(respond("v1"), respond("v2"));

            assertEquals("v1", await(invoker.invoke("settings_load")));
            clock.advance(Duration.ofSeconds(29));
            assertEquals("v1", await(invoker.invoke("settings_load")));
            clock.advance(Duration.ofSeconds(1));
            assertEquals("v2", await(invoker.invoke("settings_load")));
        }

        @Test
        @DisplayName("should keep entries with a zero time-to-live until invalidated")
        void shouldKeepZeroTtlEntries() throws Exception {
            when(delegate.invoke("get_version", null)).thenReturn(respond("1.0.0"));

            await(invoker.invoke("get_version"));
            clock.advance(Duration.ofDays(365));
            await(invoker.invoke("get_version"));

            verify(delegate, times(1)).invoke("get_version", null);
        }

        @Test
        @DisplayName("should evict the least recently used entry at capacity")
        void shouldEvictLeastRecentlyUsed() throws Exception {
            when(delegate.invoke("get_version", null)).thenReturn(respond("1.0.0"));
            when(delegate.invoke("settings_load", null)).thenReturn(respond("settings"));
            when(delegate.invoke("get_extensions", null)).thenReturn(respond("extensions"));

            await(invoker.invoke("get_version"));
            await(invoker.invoke("settings_load"));
            await(invoker.invoke("get_version"));
            await(invoker.invoke("get_extensions"));

            assertEquals(2, invoker.size());
            await(invoker.invoke("get_version"));
            await(invoker.invoke("settings_load"));
            verify(delegate, times(1)).invoke("get_version", null);
            verify(delegate, times(2)).invoke("settings_load", null);
        }
    }

    @Nested
    class InvalidationTests {

        @Test
        @DisplayName("should drop every entry of an invalidated command")
        void shouldInvalidateCommand() throws Exception {
            when(delegate.invoke(eq("get_extensions"), any())).thenReturn(respond("x"));
            await(invoker.invoke("get_extensions"));
            await(invoker.invoke("get_extensions", Map.of("page", 2)));

            invoker.invalidate("get_extensions");

            assertEquals(0, invoker.size());
        }

        @Test
        @DisplayName("should invalidate the commands mapped to an event")
        void shouldInvalidateOnEvent() throws Exception {
            when(delegate.invoke("settings_load", null)).thenReturn(respond("v1"), respond("v2"));
            when(delegate.invoke("get_version", null)).thenReturn(respond("1.0.0"));
            await(invoker.invoke("settings_load"));
            await(invoker.invoke("get_version"));

            invoker.onEvent("settings:changed");
            invoker.onEvent("unrelated:event");

            assertEquals(1, invoker.size());
            assertEquals("v2", await(invoker.invoke("settings_load")));
        }

        @Test
        @DisplayName("should not store a result whose command was invalidated while in flight")
        void shouldDiscardResultInvalidatedInFlight() throws Exception {
            CompletableFuture<Object> inFlight = new CompletableFuture<>();
            when(delegate.invoke("get_version", null)).thenReturn(inFlight, respond("2.0.0"));

            CompletableFuture<Object> stale = invoker.invoke("get_version");
            invoker.invalidate("get_version");
            inFlight.complete("1.0.0");

            assertEquals("1.0.0", await(stale));
            assertEquals(0, invoker.size());
            assertEquals("2.0.0", await(invoker.invoke("get_version")));
            assertEquals(1, invoker.size());
        }

        @Test
        @DisplayName("should not store an in-flight result after the cache was cleared")
        void shouldDiscardResultClearedInFlight() throws Exception {
            CompletableFuture<Object> inFlight = new CompletableFuture<>();
            when(delegate.invoke("settings_load", null)).thenReturn(inFlight);

            CompletableFuture<Object> stale = invoker.invoke("settings_load");
            invoker.invalidateAll();
            inFlight.complete("v1");

            assertEquals("v1", await(stale));
            assertEquals(0, invoker.size());
        }

        @Test
        @DisplayName("should clear the cache and reset the delegate on reset")
        void shouldClearOnReset() throws Exception {
            when(delegate.invoke("get_version", null)).thenReturn(respond("1.0.0"));
            await(invoker.invoke("get_version"));

            invoker.resetState();

            assertEquals(0, invoker.size());
            verify(delegate).resetState();
        }
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
