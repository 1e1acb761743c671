package com.keystone.dispatch.api;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.model.RunSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connection gets its own emitter subscribed to one run. Snapshots in event payloads
 * are sent in their {@link RunResponse} form, and each frame's id is the snapshot version
 * it reflects so a client can resume polling with {@code since}. The stream completes after
 * the run's terminal event, or right after the first snapshot when the run already finished.
 * Idle connections get comment heartbeats.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for run {}: {}", registration.runId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for run {} (emitter not active)", registration.runId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given run, starting with its
     * current snapshot.
     *
     * @param runId   the run to stream events for
     * @param current snapshot sent as the first {@code run.snapshot} event; nullable
     */
    public SseEmitter createEmitter(String runId, RunSnapshot current) {
        return createEmitter(runId, current, Set.of());
    }

    /**
     * Like {@link #createEmitter(String, RunSnapshot)}, forwarding only the given event types
     * (empty means all). The seed snapshot and the terminal event are sent regardless.
     */
    public SseEmitter createEmitter(String runId, RunSnapshot current, Set<String> eventTypes) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        var holder = new EmitterRegistration[1];
        EventBus.Subscription subscription = eventBus.subscribe(runId, eventTypes, event -> {
            sendEvent(emitter, event);
            if (EventBus.isTerminal(event) && holder[0] != null) {
                finish(holder[0]);
            }
        });

        var registration = new EmitterRegistration(runId, emitter, subscription);
        holder[0] = registration;
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
            if (current != null) {
                sendEvent(emitter, KeystoneEvent.of("run.snapshot", runId, current.activeNode(),
                        Map.of("snapshot", current)));
            }
        } catch (IOException e) {
            log.warn("Failed to send initial frames for run {}: {}", runId, e.getMessage());
        }
        if (current != null && current.status().isTerminal()) {
            finish(registration);
            return emitter;
        }

        log.info("SSE emitter created for run {} (timeout={}ms, types={})", runId, timeoutMs,
                eventTypes.isEmpty() ? "all" : eventTypes);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, KeystoneEvent event) {
        try {
            Long version = null;
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("run_id", event.runId());
            if (event.nodeId() != null) {
                data.put("node_id", event.nodeId());
            }
            for (var entry : event.payload().entrySet()) {
                if (entry.getValue() instanceof RunSnapshot snapshot) {
                    version = snapshot.version();
                    data.put(entry.getKey(), RunResponse.from(snapshot));
                } else {
                    data.put(entry.getKey(), entry.getValue());
                }
            }
            data.put("timestamp", event.timestamp().toString());

            var frame = SseEmitter.event().name(event.eventType()).data(data);
            emitter.send(version == null ? frame : frame.id(String.valueOf(version)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.eventType(), event.runId(), e.getMessage());
        }
    }

    private void finish(EmitterRegistration registration) {
        log.debug("Run {} is over, closing its SSE stream", registration.runId);
        cleanup(registration);
        registration.emitter.complete();
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
