package com.keystone.broker;

import com.keystone.core.metrics.KeystoneMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PooledConnectionLifecycleTest {

    private static final ToolServerConfig SERVER = ToolServerConfig.local("filesystem", "filesystem");

    private MutableClock clock;
    private ToolBrokerProperties properties;
    private SimpleMeterRegistry registry;
    private List<ToolConnection> opened;
    private PooledConnectionLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ToolBrokerProperties();
        properties.setRestartBackoffBase(Duration.ofMillis(1));
        properties.setMaxRestartAttempts(3);
        registry = new SimpleMeterRegistry();
        opened = new ArrayList<>();
        Function<ToolServerConfig, ToolConnection> opener = config -> {
            ToolConnection connection = mock(ToolConnection.class);
            opened.add(connection);
            return connection;
        };
        lifecycle = new PooledConnectionLifecycle(opener, properties, new KeystoneMetrics(registry), clock);
    }

    @Test
    @DisplayName("reuses one connection per server")
    void reuses() {
        lifecycle.withConnection(SERVER, c -> "a");
        lifecycle.withConnection(SERVER, c -> "b");

        assertEquals(1, opened.size());
        assertTrue(lifecycle.isPooled("filesystem"));
    }

    @Test
    @DisplayName("a remote failure evicts the connection and the next call reconnects")
    void evictsOnFailure() {
        assertThrows(ToolException.class, () -> lifecycle.withConnection(SERVER, c -> {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, "broken pipe");
        }));
        assertFalse(lifecycle.isPooled("filesystem"));
        verify(opened.get(0)).close();

        lifecycle.withConnection(SERVER, c -> "ok");

        assertEquals(2, opened.size());
        assertEquals(1.0, registry.find("keystone.tool.reconnects")
                .tag("server", "filesystem").tag("success", "true").counter().count());
    }

    @Test
    @DisplayName("argument errors keep the connection")
    void invalidArgsKeepConnection() {
        assertThrows(ToolException.class, () -> lifecycle.withConnection(SERVER, c -> {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "missing path");
        }));
        assertTrue(lifecycle.isPooled("filesystem"));
    }

    @Test
    @DisplayName("reconnects retry with backoff and give up after the limit")
    void reconnectBackoff() {
        AtomicInteger opens = new AtomicInteger();
        lifecycle = new PooledConnectionLifecycle(config -> {
            if (opens.incrementAndGet() == 1) {
                return mock(ToolConnection.class);
            }
            throw new IllegalStateException("spawn failed");
        }, properties, new KeystoneMetrics(registry), clock);
        assertThrows(ToolException.class, () -> lifecycle.withConnection(SERVER, c -> {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, "server crashed");
        }));

        var ex = assertThrows(ToolException.class, () -> lifecycle.withConnection(SERVER, c -> "x"));

        assertEquals(ToolErrorKind.REMOTE_ERROR, ex.getKind());
        assertTrue(ex.getMessage().contains("after 3 reconnect attempts"));
        assertEquals(4, opens.get());
        assertEquals(3.0, registry.find("keystone.tool.reconnects")
                .tag("server", "filesystem").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("idle connections are closed by the sweep")
    void evictIdle() {
        properties.setPoolIdleTtl(Duration.ofMinutes(10));
        lifecycle.withConnection(SERVER, c -> "a");

        clock.advance(Duration.ofMinutes(11));
        lifecycle.evictIdle();

        assertFalse(lifecycle.isPooled("filesystem"));
        verify(opened.get(0)).close();
    }

    @Test
    @DisplayName("an idle connection is replaced on acquire")
    void idleReplacedOnAcquire() {
        properties.setPoolIdleTtl(Duration.ofMinutes(10));
        lifecycle.withConnection(SERVER, c -> "a");
        clock.advance(Duration.ofMinutes(11));

        lifecycle.withConnection(SERVER, c -> "b");

        assertEquals(2, opened.size());
        verify(opened.get(0)).close();
    }
}
