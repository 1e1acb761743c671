package com.keystone.broker;

import com.keystone.core.metrics.KeystoneMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps one connection per server.
 * <p>
 * A connection is evicted when it sits idle past the TTL or when a call on it fails with
 * anything other than an argument error. Re-opening an evicted server is retried with
 * exponential backoff ({@code restart-backoff-base * 2^attempt}) up to
 * {@code max-restart-attempts} times.
 */
public class PooledConnectionLifecycle implements ConnectionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PooledConnectionLifecycle.class);

    private final Function<ToolServerConfig, ToolConnection> opener;
    private final ToolBrokerProperties properties;
    private final KeystoneMetrics metrics;
    private final Clock clock;

    private final Map<String, Pooled> pool = new ConcurrentHashMap<>();
    private final Map<String, Object> openLocks = new ConcurrentHashMap<>();
    private final Map<String, Boolean> evicted = new ConcurrentHashMap<>();

    public PooledConnectionLifecycle(Function<ToolServerConfig, ToolConnection> opener,
                                     ToolBrokerProperties properties, KeystoneMetrics metrics, Clock clock) {
        this.opener = opener;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public <T> T withConnection(ToolServerConfig config, Function<ToolConnection, T> work) {
        Pooled pooled = acquire(config);
        try {
            T result = work.apply(pooled.connection());
            pooled.touch(clock.instant());
            return result;
        } catch (ToolException e) {
            if (e.getKind() != ToolErrorKind.INVALID_ARGS) {
                evict(config.serverId(), pooled, e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            evict(config.serverId(), pooled, e.getMessage());
            throw e;
        }
    }

    @Override
    public void invalidate(String serverId) {
        Pooled pooled = pool.remove(serverId);
        if (pooled != null) {
            pooled.connection().close();
        }
    }

    @Override
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(properties.getPoolIdleTtl());
        for (var entry : pool.entrySet()) {
            if (entry.getValue().lastUsed().isBefore(cutoff) && pool.remove(entry.getKey(), entry.getValue())) {
                log.info("Closing idle connection to tool server '{}'", entry.getKey());
                entry.getValue().connection().close();
            }
        }
    }

    @Override
    public void close() {
        pool.forEach((serverId, pooled) -> pooled.connection().close());
        pool.clear();
    }

    boolean isPooled(String serverId) {
        return pool.containsKey(serverId);
    }

    private Pooled acquire(ToolServerConfig config) {
        String serverId = config.serverId();
        Pooled existing = pool.get(serverId);
        if (existing != null && !isIdle(existing)) {
            return existing;
        }
        synchronized (openLocks.computeIfAbsent(serverId, k -> new Object())) {
            existing = pool.get(serverId);
            if (existing != null && isIdle(existing)) {
                pool.remove(serverId, existing);
                existing.connection().close();
                existing = null;
            }
            if (existing != null) {
                return existing;
            }
            boolean restart = evicted.remove(serverId) != null;
            Pooled opened = new Pooled(restart ? reopenWithBackoff(config) : opener.apply(config), clock.instant());
            pool.put(serverId, opened);
            return opened;
        }
    }

    private ToolConnection reopenWithBackoff(ToolServerConfig config) {
        int attempts = Math.max(1, properties.getMaxRestartAttempts());
        RuntimeException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                ToolConnection connection = opener.apply(config);
                metrics.recordConnectionRestart(config.serverId(), true);
                log.info("Reconnected to tool server '{}' on attempt {}", config.serverId(), attempt + 1);
                return connection;
            } catch (ToolException e) {
                if (e.getKind() == ToolErrorKind.NOT_CONFIGURED) {
                    throw e;
                }
                last = e;
            } catch (RuntimeException e) {
                last = e;
            }
            metrics.recordConnectionRestart(config.serverId(), false);
            Duration backoff = properties.getRestartBackoffBase().multipliedBy(1L << attempt);
            log.warn("Reconnect to '{}' failed (attempt {}/{}), retrying in {} ms: {}",
                    config.serverId(), attempt + 1, attempts, backoff.toMillis(), last.getMessage());
            if (attempt + 1 < attempts) {
                sleep(backoff);
            }
        }
        evicted.put(config.serverId(), Boolean.TRUE);
        throw new ToolException(ToolErrorKind.REMOTE_ERROR,
                "Tool server '" + config.serverId() + "' unavailable after " + attempts + " reconnect attempts", last);
    }

    private void evict(String serverId, Pooled pooled, String reason) {
        if (pool.remove(serverId, pooled)) {
            log.warn("Evicting connection to tool server '{}': {}", serverId, reason);
            evicted.put(serverId, Boolean.TRUE);
            pooled.connection().close();
        }
    }

    private boolean isIdle(Pooled pooled) {
        return pooled.lastUsed().plus(properties.getPoolIdleTtl()).isBefore(clock.instant());
    }

    private static void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolException(ToolErrorKind.CANCELLED, "Interrupted while reconnecting", e);
        }
    }

    private static final class Pooled {

        private final ToolConnection connection;
        private volatile Instant lastUsed;

        Pooled(ToolConnection connection, Instant lastUsed) {
            this.connection = connection;
            this.lastUsed = lastUsed;
        }

        ToolConnection connection() {
            return connection;
        }

        Instant lastUsed() {
            return lastUsed;
        }

        void touch(Instant now) {
            lastUsed = now;
        }
    }
}
