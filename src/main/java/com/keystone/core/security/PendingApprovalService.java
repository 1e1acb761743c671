package com.keystone.core.security;

import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.metrics.KeystoneMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ApprovalCallback} that parks held calls until someone resolves them through the
 * approvals API. Each request is announced with an {@code approval.requested} event.
 */
@Service
public class PendingApprovalService implements ApprovalCallback {

    private static final Logger log = LoggerFactory.getLogger(PendingApprovalService.class);

    private final EventBus eventBus;
    private final KeystoneMetrics metrics;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public PendingApprovalService(EventBus eventBus, KeystoneMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public ApprovalDecision requestApproval(ApprovalRequest request, Duration timeout, CancellationToken token) {
        var future = new CompletableFuture<ApprovalDecision>();
        pending.put(request.id(), new Pending(request, future));
        CancellationToken.Registration registration =
                token.onCancel(() -> future.complete(ApprovalDecision.deny("cancelled")));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approvalId", request.id());
        payload.put("tool", request.toolName());
        payload.put("pattern", request.matchedPattern());
        eventBus.publish(KeystoneEvent.of("approval.requested", request.runId(), request.nodeId(), payload));
        log.warn("Tool call {} held for approval (pattern '{}'), approval id {}",
                request.toolName(), request.matchedPattern(), request.id());

        try {
            ApprovalDecision decision = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordApproval(decision.approved() ? "approved" : "denied");
            return decision;
        } catch (TimeoutException e) {
            metrics.recordApproval("timeout");
            return ApprovalDecision.deny("approval timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApprovalDecision.deny("interrupted while waiting for approval");
        } catch (ExecutionException e) {
            log.error("Approval {} completed exceptionally: {}", request.id(), e.getMessage(), e);
            return ApprovalDecision.deny("approval failed: " + e.getMessage());
        } finally {
            registration.remove();
            pending.remove(request.id());
        }
    }

    /**
     * Resolves a pending request.
     *
     * @return false when no request with that id is waiting
     */
    public boolean resolve(String approvalId, boolean approved, String reason) {
        Pending entry = pending.get(approvalId);
        if (entry == null) {
            return false;
        }
        String why = reason == null || reason.isBlank() ? (approved ? "approved" : "denied") : reason;
        log.info("Approval {} {}: {}", approvalId, approved ? "granted" : "denied", why);
        return entry.future().complete(new ApprovalDecision(approved, why));
    }

    public List<ApprovalRequest> pending() {
        return pending.values().stream()
                .map(Pending::request)
                .sorted(Comparator.comparing(ApprovalRequest::requestedAt))
                .toList();
    }

    public Optional<ApprovalRequest> find(String approvalId) {
        return Optional.ofNullable(pending.get(approvalId)).map(Pending::request);
    }

    private record Pending(ApprovalRequest request, CompletableFuture<ApprovalDecision> future) {}
}
