package com.keystone.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the run loop, the Executor and the
 * ToolBroker.
 * <p>
 * Tokens form a tree: cancelling a token cancels every child created from it. Listeners
 * registered with {@link #onCancel(Runnable)} fire exactly once, immediately if the token
 * is already cancelled.
 */
public final class CancellationToken implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CancellationToken parent;
    private final Runnable parentListener;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
        if (parent != null) {
            this.parentListener = this::cancel;
            parent.onCancel(parentListener);
        } else {
            this.parentListener = null;
        }
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /** A token that is never cancelled; for calls made outside any run. */
    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            fire(listener);
        }
        listeners.clear();
    }

    /**
     * Registers a listener that runs when this token is cancelled.
     *
     * @return a handle that removes the listener
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            fire(listener);
        }
        return () -> listeners.remove(listener);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("cancelled");
        }
    }

    /** Detaches this token from its parent. */
    @Override
    public void close() {
        if (parent != null) {
            parent.listeners.remove(parentListener);
        }
    }

    private static void fire(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
