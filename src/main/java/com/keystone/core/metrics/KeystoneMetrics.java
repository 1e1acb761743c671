package com.keystone.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Keystone run execution.
 */
@Service
public class KeystoneMetrics {

    private final MeterRegistry registry;

    public KeystoneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one Plan, Execute or Verify phase.
     *
     * @param phase   "plan", "execute" or "verify"
     * @param outcome phase outcome, e.g. "ok", "approve", "reject", "error"
     */
    public void recordPhase(String phase, String outcome, long ms) {
        Timer.builder("keystone.phase.duration")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordToolCall(String serverId, String result, Duration duration) {
        Timer.builder("keystone.tool.duration")
                .tag("server", serverId == null ? "unknown" : serverId)
                .tag("result", result)
                .register(registry)
                .record(duration);
    }

    public void incrementToolTimeouts(String serverId) {
        Counter.builder("keystone.tool.timeouts")
                .description("Tool calls that exceeded their deadline")
                .tag("server", serverId == null ? "unknown" : serverId)
                .register(registry)
                .increment();
    }

    public void incrementRejects(String source) {
        Counter.builder("keystone.rejects.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementDecompositions() {
        Counter.builder("keystone.decompositions.total")
                .register(registry)
                .increment();
    }

    public void incrementAbandoned(String reason) {
        Counter.builder("keystone.nodes.abandoned")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDecompositionDepth(int depth) {
        DistributionSummary.builder("keystone.decomposition.depth")
                .register(registry)
                .record(depth);
    }

    public void recordRunResult(String status) {
        Counter.builder("keystone.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a danger-gate approval request.
     *
     * @param decision "approved", "denied" or "timeout"
     */
    public void recordApproval(String decision) {
        Counter.builder("keystone.approvals.total")
                .description("Human approval decisions for dangerous tool calls")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordConnectionRestart(String serverId, boolean success) {
        Counter.builder("keystone.tool.reconnects")
                .tag("server", serverId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
