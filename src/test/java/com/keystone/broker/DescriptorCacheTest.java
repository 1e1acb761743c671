package com.keystone.broker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class DescriptorCacheTest {

    private MutableClock clock;
    private DescriptorCache cache;
    private AtomicInteger loads;
    private Supplier<List<ToolDescriptor>> loader;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cache = new DescriptorCache(Duration.ofMinutes(5), clock);
        loads = new AtomicInteger();
        loader = () -> {
            loads.incrementAndGet();
            return List.of(new ToolDescriptor("filesystem", "read_file", "Read a file", Map.of(), List.of("files")));
        };
    }

    @Test
    @DisplayName("fresh entries are served without reloading")
    void servesFresh() {
        cache.get("filesystem", loader);
        clock.advance(Duration.ofMinutes(4));
        var descriptors = cache.get("filesystem", loader);

        assertEquals(1, loads.get());
        assertEquals("read_file", descriptors.get(0).toolName());
        assertTrue(cache.peek("filesystem").isPresent());
    }

    @Test
    @DisplayName("stale entries are reloaded after the TTL")
    void reloadsStale() {
        cache.get("filesystem", loader);
        clock.advance(Duration.ofMinutes(5));

        assertTrue(cache.peek("filesystem").isEmpty());
        cache.get("filesystem", loader);
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("invalidation forces a reload")
    void invalidate() {
        cache.get("filesystem", loader);
        cache.get("shell", loader);
        cache.invalidate("filesystem");
        cache.get("filesystem", loader);
        assertEquals(3, loads.get());

        cache.invalidateAll();
        assertTrue(cache.peek("shell").isEmpty());
    }

    @Test
    @DisplayName("a failing loader caches nothing")
    void failingLoader() {
        assertThrows(ToolException.class, () -> cache.get("filesystem", () -> {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, "server down");
        }));
        assertTrue(cache.peek("filesystem").isEmpty());
    }

    @Test
    @DisplayName("a server whose load never returns does not hold up other servers")
    void hungLoadIsolated() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<List<ToolDescriptor>> slow = CompletableFuture.supplyAsync(() -> cache.get("slow", () -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        }));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<List<ToolDescriptor>> fast = CompletableFuture.supplyAsync(() -> cache.get("fast", loader));

        assertEquals("read_file", fast.get(2, TimeUnit.SECONDS).get(0).toolName());
        assertTrue(cache.peek("fast").isPresent());
        assertFalse(slow.isDone());
        release.countDown();
        assertTrue(slow.get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    @DisplayName("concurrent misses for one server share a single load")
    void singleFlight() throws Exception {
        var pending = new CompletableFuture<List<ToolDescriptor>>();
        var first = cache.lookup("filesystem", id -> {
            loads.incrementAndGet();
            return pending;
        });
        var second = cache.lookup("filesystem", id -> {
            loads.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
        });

        assertSame(first, second);
        assertFalse(first.isDone());
        pending.complete(List.of(new ToolDescriptor("filesystem", "read_file", "Read a file", Map.of(), List.of())));

        assertEquals("read_file", second.get(1, TimeUnit.SECONDS).get(0).toolName());
        assertEquals(1, loads.get());
        assertTrue(cache.peek("filesystem").isPresent());
    }

    @Test
    @DisplayName("a load detached by invalidation is not stored")
    void invalidatedLoadNotStored() throws Exception {
        var pending = new CompletableFuture<List<ToolDescriptor>>();
        var lookup = cache.lookup("filesystem", id -> pending);
        cache.invalidate("filesystem");
        pending.complete(loader.get());

        assertEquals(1, lookup.get(1, TimeUnit.SECONDS).size());
        assertTrue(cache.peek("filesystem").isEmpty());
    }
}
