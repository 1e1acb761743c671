package com.keystone.broker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-server descriptor lists with a time-to-live.
 * <p>
 * Fresh entries are served under the read lock. A stale or missing entry is reloaded by a
 * single in-flight load per server; concurrent misses for that server share it. Loads run
 * outside the lock, so a server that never answers only holds up callers of that server.
 * A failed load caches nothing. Invalidating a server detaches any load still in flight,
 * whose result is then handed to its waiters but not stored.
 */
public class DescriptorCache {

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();
    private final Map<String, CompletableFuture<List<ToolDescriptor>>> inFlight = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public DescriptorCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Blocking lookup; the loader runs on the calling thread when this call starts the load.
     */
    public List<ToolDescriptor> get(String serverId, Supplier<List<ToolDescriptor>> loader) {
        CompletableFuture<List<ToolDescriptor>> lookup = lookup(serverId, id -> {
            try {
                return CompletableFuture.completedFuture(loader.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
        try {
            return lookup.get();
        } catch (ExecutionException e) {
            throw ToolBroker.classify(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolException(ToolErrorKind.CANCELLED, "interrupted while loading descriptors of '" + serverId + "'");
        }
    }

    /**
     * Fresh descriptors as a completed future, the server's in-flight load, or a new load
     * started with {@code loader}. Never blocks on a load.
     */
    public CompletableFuture<List<ToolDescriptor>> lookup(
            String serverId, Function<String, CompletableFuture<List<ToolDescriptor>>> loader) {
        CompletableFuture<List<ToolDescriptor>> flight;
        lock.readLock().lock();
        try {
            Entry entry = entries.get(serverId);
            if (isFresh(entry)) {
                return CompletableFuture.completedFuture(entry.descriptors());
            }
        } finally {
            lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            Entry entry = entries.get(serverId);
            if (isFresh(entry)) {
                return CompletableFuture.completedFuture(entry.descriptors());
            }
            CompletableFuture<List<ToolDescriptor>> running = inFlight.get(serverId);
            if (running != null) {
                return running;
            }
            flight = new CompletableFuture<>();
            inFlight.put(serverId, flight);
        } finally {
            lock.writeLock().unlock();
        }

        CompletableFuture<List<ToolDescriptor>> load;
        try {
            load = loader.apply(serverId);
        } catch (RuntimeException e) {
            load = CompletableFuture.failedFuture(e);
        }
        load.whenComplete((descriptors, error) -> settle(serverId, flight, descriptors, error));
        return flight;
    }

    public Optional<List<ToolDescriptor>> peek(String serverId) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(serverId);
            return isFresh(entry) ? Optional.of(entry.descriptors()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void invalidate(String serverId) {
        lock.writeLock().lock();
        try {
            entries.remove(serverId);
            inFlight.remove(serverId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            entries.clear();
            inFlight.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void settle(String serverId, CompletableFuture<List<ToolDescriptor>> flight,
                        List<ToolDescriptor> descriptors, Throwable error) {
        if (error != null) {
            lock.writeLock().lock();
            try {
                inFlight.remove(serverId, flight);
            } finally {
                lock.writeLock().unlock();
            }
            flight.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error);
            return;
        }
        List<ToolDescriptor> loaded = List.copyOf(descriptors);
        lock.writeLock().lock();
        try {
            if (inFlight.remove(serverId, flight)) {
                entries.put(serverId, new Entry(loaded, clock.instant()));
            }
        } finally {
            lock.writeLock().unlock();
        }
        flight.complete(loaded);
    }

    private boolean isFresh(Entry entry) {
        return entry != null && clock.instant().isBefore(entry.loadedAt().plus(ttl));
    }

    private record Entry(List<ToolDescriptor> descriptors, Instant loadedAt) {}
}
