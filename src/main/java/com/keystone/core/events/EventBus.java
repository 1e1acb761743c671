package com.keystone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for run events.
 * <p>
 * Run subscribers may restrict themselves to a set of event types. A run publishes exactly
 * one terminal event ({@link #TERMINAL_EVENTS}); once it has been delivered the run's
 * subscriber list is dropped, so watchers of finished runs never leak. Global subscribers
 * see every event and stay registered until they unsubscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final Set<String> TERMINAL_EVENTS = Set.of("run.completed", "run.failed", "run.aborted");

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> runListeners = new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<KeystoneEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(KeystoneEvent event) {
        log.debug("Publishing {} for run {} node {}", event.eventType(), event.runId(), event.nodeId());

        List<Listener> listeners = runListeners.get(event.runId());
        if (listeners != null) {
            for (Listener listener : listeners) {
                if (listener.accepts(event)) {
                    deliverSafely(listener.consumer(), event);
                }
            }
        }
        for (Consumer<KeystoneEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        if (isTerminal(event)) {
            var dropped = runListeners.remove(event.runId());
            if (dropped != null) {
                log.debug("Run {} finished ({}), released {} subscriber(s)",
                        event.runId(), event.eventType(), dropped.size());
            }
        }
    }

    /**
     * Subscribes to every event of one run until the run finishes or the handle is released.
     */
    public Subscription subscribe(String runId, Consumer<KeystoneEvent> consumer) {
        return subscribe(runId, Set.of(), consumer);
    }

    /**
     * Subscribes to the given event types of one run. Terminal events are always delivered
     * so the subscriber learns the run is over.
     *
     * @param eventTypes types to receive; empty means all
     */
    public Subscription subscribe(String runId, Set<String> eventTypes, Consumer<KeystoneEvent> consumer) {
        var listener = new Listener(Set.copyOf(eventTypes), consumer);
        runListeners.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed to run {} {}", runId, eventTypes.isEmpty() ? "(all events)" : eventTypes);
        return () -> {
            var listeners = runListeners.get(runId);
            if (listeners != null) {
                listeners.remove(listener);
                if (listeners.isEmpty()) {
                    runListeners.remove(runId, listeners);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<KeystoneEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String runId) {
        var listeners = runListeners.get(runId);
        return listeners == null ? 0 : listeners.size();
    }

    public static boolean isTerminal(KeystoneEvent event) {
        return TERMINAL_EVENTS.contains(event.eventType());
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener(Set<String> eventTypes, Consumer<KeystoneEvent> consumer) {
        boolean accepts(KeystoneEvent event) {
            return eventTypes.isEmpty() || eventTypes.contains(event.eventType()) || isTerminal(event);
        }
    }

    private void deliverSafely(Consumer<KeystoneEvent> subscriber, KeystoneEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
