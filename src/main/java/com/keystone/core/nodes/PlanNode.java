package com.keystone.core.nodes;

import com.keystone.core.agent.AgentRoster;
import com.keystone.core.agent.PlanRequest;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.PlanProposal;
import com.keystone.core.state.AttemptOutcome;
import com.keystone.core.state.AttemptScopes;
import com.keystone.core.state.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Asks the Planner for a strategy when the node has none. A node that already carries a
 * strategy skips planning. The call is bounded by the roster's {@link
 * com.keystone.core.agent.AgentCallGuard}; cancelling the attempt interrupts it.
 */
@Component
public class PlanNode {

    private static final Logger log = LoggerFactory.getLogger(PlanNode.class);

    private final AgentRoster roster;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final AttemptScopes scopes;

    public PlanNode(AgentRoster roster, AuditLog auditLog, KeystoneMetrics metrics, AttemptScopes scopes) {
        this.roster = roster;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.scopes = scopes;
    }

    public Map<String, Object> apply(AttemptState state) {
        if (!state.strategy().isBlank()) {
            return Map.of();
        }
        CancellationToken token = scopes.token(state.attemptId());
        if (token.isCancelled()) {
            return Map.of(AttemptState.OUTCOME, AttemptOutcome.CANCELLED.name());
        }
        MdcContext.setAgent(state.runId(), state.nodeId(), AuditActors.PLANNER);
        long start = System.currentTimeMillis();
        var request = new PlanRequest(state.runId(), state.nodeId(), state.goal(), state.contextStack(),
                state.memoryHits(), state.rejections(), state.temperature(), state.sessionToken());
        try {
            PlanProposal proposal = roster.calls().call(AuditActors.PLANNER, token, () -> roster.planner().plan(request));
            metrics.recordPhase("plan", "ok", System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.PLANNER, "plan",
                    Map.of("strategy", proposal.strategy(), "calls", proposal.intents(),
                            "temperature", state.temperature()),
                    "ok", proposal.strategy());

            Map<String, Object> updates = new HashMap<>();
            updates.put(AttemptState.STRATEGY, proposal.strategy());
            updates.put(AttemptState.INTENTS, proposal.intents());
            if (proposal.sessionToken() != null) {
                updates.put(AttemptState.SESSION_TOKEN, proposal.sessionToken());
            }
            return updates;
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.info("Planning of node {} cancelled", state.nodeId());
                metrics.recordPhase("plan", "cancelled", System.currentTimeMillis() - start);
                return Map.of(AttemptState.OUTCOME, AttemptOutcome.CANCELLED.name());
            }
            log.warn("Planner failed for node {}: {}", state.nodeId(), e.getMessage(), e);
            metrics.recordPhase("plan", "error", System.currentTimeMillis() - start);
            auditLog.append(state.runId(), state.nodeId(), AuditActors.PLANNER, "plan",
                    Map.of("error", String.valueOf(e.getMessage())), "error", e.getMessage());
            return Map.of(AttemptState.OUTCOME, AttemptOutcome.REJECTED.name(),
                    AttemptState.RATIONALE, "agent_unavailable: planner failed: " + e.getMessage());
        } finally {
            MdcContext.clearAgent();
        }
    }
}
