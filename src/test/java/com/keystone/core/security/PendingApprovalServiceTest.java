package com.keystone.core.security;

import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.metrics.KeystoneMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PendingApprovalServiceTest {

    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private PendingApprovalService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        service = new PendingApprovalService(eventBus, new KeystoneMetrics(registry));
    }

    private static ApprovalRequest request(String id) {
        return new ApprovalRequest(id, "RUN-1", "1.2", "shell", "run_command",
                Map.of("command", "rm -rf /var"), "rm -rf /", Instant.now());
    }

    private CompletableFuture<ApprovalDecision> requestAsync(String id, Duration timeout, CancellationToken token) {
        CompletableFuture<ApprovalDecision> decision =
                CompletableFuture.supplyAsync(() -> service.requestApproval(request(id), timeout, token));
        long deadline = System.currentTimeMillis() + 5000;
        while (service.find(id).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        return decision;
    }

    @Test
    @DisplayName("an approved request returns the decision and announces itself")
    void approve() throws Exception {
        List<KeystoneEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("RUN-1", events::add);

        var decision = requestAsync("APR-1", Duration.ofSeconds(5), CancellationToken.create());
        assertEquals(1, service.pending().size());
        assertTrue(service.resolve("APR-1", true, null));

        ApprovalDecision result = decision.get(5, TimeUnit.SECONDS);
        assertTrue(result.approved());
        assertEquals("approved", result.reason());
        assertTrue(service.pending().isEmpty());
        assertEquals("approval.requested", events.get(0).eventType());
        assertEquals("APR-1", events.get(0).payload().get("approvalId"));
        assertEquals(1.0, registry.find("keystone.approvals.total").tag("decision", "approved").counter().count());
    }

    @Test
    @DisplayName("a denial carries its reason")
    void deny() throws Exception {
        var decision = requestAsync("APR-2", Duration.ofSeconds(5), CancellationToken.create());
        service.resolve("APR-2", false, "not on production");

        ApprovalDecision result = decision.get(5, TimeUnit.SECONDS);
        assertFalse(result.approved());
        assertEquals("not on production", result.reason());
    }

    @Test
    @DisplayName("no decision within the timeout is a denial")
    void timeout() {
        ApprovalDecision result = service.requestApproval(request("APR-3"), Duration.ofMillis(50),
                CancellationToken.create());

        assertFalse(result.approved());
        assertTrue(result.reason().contains("timed out"));
        assertEquals(1.0, registry.find("keystone.approvals.total").tag("decision", "timeout").counter().count());
    }

    @Test
    @DisplayName("cancellation of the owning token denies the request")
    void cancelled() throws Exception {
        var token = CancellationToken.create();
        var decision = requestAsync("APR-4", Duration.ofSeconds(5), token);
        token.cancel();

        ApprovalDecision result = decision.get(5, TimeUnit.SECONDS);
        assertFalse(result.approved());
        assertEquals("cancelled", result.reason());
    }

    @Test
    @DisplayName("resolving an unknown id reports false")
    void unknownId() {
        assertFalse(service.resolve("APR-missing", true, "ok"));
    }
}
