package com.keystone.core.nodes;

import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.agent.AgentRoster;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.Verdict;
import com.keystone.core.model.VerificationResult;
import com.keystone.core.state.AttemptOutcome;
import com.keystone.core.state.AttemptScopes;
import com.keystone.core.state.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Asks the Verifier to judge the attempt. A tool timeout is a rejection without
 * consulting the Verifier. Verifier calls are bounded like Planner calls.
 */
@Component
public class VerifyNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyNode.class);

    private final AgentRoster roster;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final AttemptScopes scopes;

    public VerifyNode(AgentRoster roster, AuditLog auditLog, KeystoneMetrics metrics, AttemptScopes scopes) {
        this.roster = roster;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.scopes = scopes;
    }

    public Map<String, Object> apply(AttemptState state) {
        CancellationToken token = scopes.token(state.attemptId());
        if (token.isCancelled()) {
            return Map.of(AttemptState.OUTCOME, AttemptOutcome.CANCELLED.name());
        }
        ResultBundle bundle = state.resultBundle()
                .orElseThrow(() -> new IllegalStateException("Result bundle must be present before verification"));
        MdcContext.setAgent(state.runId(), state.nodeId(), AuditActors.VERIFIER);
        long start = System.currentTimeMillis();
        try {
            VerificationResult result;
            if (bundle.timedOut()) {
                ToolInvocationResult timedOut = bundle.results().stream()
                        .filter(ToolInvocationResult::timedOut).findFirst().orElseThrow();
                result = VerificationResult.reject("timeout: " + timedOut.toolName() + " on "
                        + timedOut.serverId() + " exceeded its deadline");
            } else {
                result = roster.calls().call(AuditActors.VERIFIER, token,
                        () -> roster.verifier().verify(bundle, state.goal()));
            }
            String outcome = result.verdict().name().toLowerCase();
            metrics.recordPhase("verify", outcome, System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.VERIFIER, "verify",
                    Map.of("verdict", result.verdict().name(), "rationale", result.rationale()),
                    outcome, result.fullRationale());
            return toUpdates(result);
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.info("Verification of node {} cancelled", state.nodeId());
                metrics.recordPhase("verify", "cancelled", System.currentTimeMillis() - start);
                return Map.of(AttemptState.OUTCOME, AttemptOutcome.CANCELLED.name());
            }
            log.warn("Verifier failed for node {}: {}", state.nodeId(), e.getMessage(), e);
            metrics.recordPhase("verify", "error", System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.VERIFIER, "verify",
                    Map.of("error", String.valueOf(e.getMessage())), "error", e.getMessage());
            return Map.of(AttemptState.OUTCOME, AttemptOutcome.REJECTED.name(),
                    AttemptState.RATIONALE, "agent_unavailable: verifier failed: " + e.getMessage());
        } finally {
            MdcContext.clearAgent();
        }
    }

    static Map<String, Object> toUpdates(VerificationResult result) {
        Map<String, Object> updates = new HashMap<>();
        updates.put(AttemptState.VERDICT, result.verdict().name());
        updates.put(AttemptState.RATIONALE, result.rationale());
        if (result.remediation() != null) {
            updates.put(AttemptState.REMEDIATION, result.remediation());
        }
        updates.put(AttemptState.OUTCOME, outcomeOf(result.verdict()).name());
        return updates;
    }

    public static AttemptOutcome outcomeOf(Verdict verdict) {
        return switch (verdict) {
            case APPROVE -> AttemptOutcome.APPROVED;
            case REJECT -> AttemptOutcome.REJECTED;
            case NEED_MORE_INFO -> AttemptOutcome.NEED_MORE_INFO;
        };
    }
}
