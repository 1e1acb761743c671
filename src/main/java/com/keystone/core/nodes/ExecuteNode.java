package com.keystone.core.nodes;

import com.keystone.core.agent.AgentRoster;
import com.keystone.core.agent.ExecutionRequest;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.state.AttemptOutcome;
import com.keystone.core.state.AttemptScopes;
import com.keystone.core.state.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs the planned tool calls through the Executor.
 */
@Component
public class ExecuteNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteNode.class);

    private final AgentRoster roster;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final AttemptScopes scopes;

    public ExecuteNode(AgentRoster roster, AuditLog auditLog, KeystoneMetrics metrics, AttemptScopes scopes) {
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
        MdcContext.setAgent(state.runId(), state.nodeId(), AuditActors.EXECUTOR);
        long start = System.currentTimeMillis();
        try {
            ResultBundle bundle = roster.executor().execute(new ExecutionRequest(state.runId(), state.nodeId(),
                    state.goal(), state.strategy(), state.intents(), state.constraints(), token));
            String outcome = bundle.aborted() ? "aborted"
                    : bundle.cancelled() ? "cancelled"
                    : bundle.hasFailures() ? "failed" : "ok";
            metrics.recordPhase("execute", outcome, System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.EXECUTOR, "execute",
                    Map.of("calls", bundle.results().size(), "summary", bundle.summary()),
                    outcome, bundle.aborted() ? bundle.abortReason() : bundle.summary());

            if (bundle.aborted()) {
                return Map.of(AttemptState.RESULT_BUNDLE, bundle,
                        AttemptState.OUTCOME, AttemptOutcome.ABORTED.name(),
                        AttemptState.RATIONALE, bundle.abortReason());
            }
            if (bundle.cancelled()) {
                return Map.of(AttemptState.RESULT_BUNDLE, bundle,
                        AttemptState.OUTCOME, AttemptOutcome.CANCELLED.name());
            }
            return Map.of(AttemptState.RESULT_BUNDLE, bundle);
        } catch (RuntimeException e) {
            log.warn("Executor failed for node {}: {}", state.nodeId(), e.getMessage(), e);
            metrics.recordPhase("execute", "error", System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.EXECUTOR, "execute",
                    Map.of("error", String.valueOf(e.getMessage())), "error", e.getMessage());
            return Map.of(AttemptState.OUTCOME, AttemptOutcome.REJECTED.name(),
                    AttemptState.RATIONALE, "agent_unavailable: executor failed: " + e.getMessage());
        } finally {
            MdcContext.clearAgent();
        }
    }
}
