package com.keystone.dispatch.api;

import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.model.RunMetrics;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = spy(new EventBus());
        service = new SseStreamingService(eventBus, 60_000L);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
    }

    private static RunSnapshot snapshot() {
        return snapshot(RunStatus.RUNNING);
    }

    private static RunSnapshot snapshot(RunStatus status) {
        return new RunSnapshot("run-1", 3, status, "goal", List.of(), "1", List.of(),
                new RunMetrics(1, 0, 0, 0, 0, 0, 0, 0, 10), null, Instant.now());
    }

    // -- Emitter creation tests -----------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per connection and subscribes it to the run")
        void createsEmitters() {
            SseEmitter first = service.createEmitter("run-1", snapshot());
            SseEmitter second = service.createEmitter("run-1", null);

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
            verify(eventBus, times(2)).subscribe(eq("run-1"), anySet(), any());
        }

        @Test
        @DisplayName("a type filter is handed to the event bus")
        void typeFilter() {
            service.createEmitter("run-1", null, Set.of("node.decomposed"));

            verify(eventBus).subscribe(eq("run-1"), eq(Set.of("node.decomposed")), any());
        }

        @Test
        @DisplayName("emitters use the configured timeout")
        void usesTimeout() {
            assertEquals(60_000L, service.createEmitter("run-1", null).getTimeout());
        }
    }

    // -- Event forwarding tests -----------------------------------------------

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("events for the run reach the emitter's subscriber without errors")
        void forwardsEvents() {
            service.createEmitter("run-1", null);
            @SuppressWarnings("unchecked")
            ArgumentCaptor<Consumer<KeystoneEvent>> subscriber = ArgumentCaptor.forClass(Consumer.class);
            verify(eventBus).subscribe(eq("run-1"), anySet(), subscriber.capture());

            assertDoesNotThrow(() -> subscriber.getValue().accept(
                    KeystoneEvent.of("run.snapshot", "run-1", "1", Map.of("snapshot", snapshot()))));
            assertDoesNotThrow(() -> eventBus.publish(
                    KeystoneEvent.of("node.status", "run-1", "1", Map.of("status", "ACTIVE"))));
        }

        @Test
        @DisplayName("a completed emitter swallows later events")
        void completedEmitter() {
            SseEmitter emitter = service.createEmitter("run-1", null);
            emitter.complete();

            assertDoesNotThrow(() -> eventBus.publish(
                    KeystoneEvent.of("run.completed", "run-1", null, Map.of("status", "SUCCEEDED"))));
        }

        @Test
        @DisplayName("events for other runs are not subscribed to")
        void noCrossDelivery() {
            service.createEmitter("run-1", null);

            verify(eventBus, never()).subscribe(eq("run-2"), anySet(), any());
        }
    }

    @Nested
    @DisplayName("run end")
    class RunEndTests {

        @Test
        @DisplayName("the terminal event closes the stream and releases the subscription")
        void terminalClosesStream() {
            service.createEmitter("run-1", snapshot());
            assertEquals(1, service.activeEmitterCount());

            eventBus.publish(KeystoneEvent.of("run.completed", "run-1", null, Map.of("status", "SUCCEEDED")));

            assertEquals(0, service.activeEmitterCount());
            assertEquals(0, eventBus.subscriberCount("run-1"));
        }

        @Test
        @DisplayName("connecting to a finished run sends the snapshot and closes at once")
        void finishedRun() {
            SseEmitter emitter = service.createEmitter("run-1", snapshot(RunStatus.SUCCEEDED));

            assertNotNull(emitter);
            assertEquals(0, service.activeEmitterCount());
            assertEquals(0, eventBus.subscriberCount("run-1"));
        }
    }
}
