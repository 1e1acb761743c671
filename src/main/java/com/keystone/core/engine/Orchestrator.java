package com.keystone.core.engine;

import com.keystone.broker.ToolInvocationResult;
import com.keystone.core.agent.AgentRoster;
import com.keystone.core.agent.DecomposeRequest;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.graph.AttemptGraph;
import com.keystone.core.graph.GraphValidationException;
import com.keystone.core.graph.TaskGraph;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.memory.MemoryConsolidationJob;
import com.keystone.core.memory.MemoryProperties;
import com.keystone.core.memory.MemoryStore;
import com.keystone.core.memory.StrategyOutcome;
import com.keystone.core.memory.StrategyRecord;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;
import com.keystone.core.model.SubgoalProposal;
import com.keystone.core.model.TaskNodeView;
import com.keystone.core.model.TaskStatus;
import com.keystone.core.model.VerificationResult;
import com.keystone.core.nodes.VerifyNode;
import com.keystone.core.state.AttemptOutcome;
import com.keystone.core.state.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives one run to completion. Owns its {@link RunContext} and is the only writer of
 * the run's {@link TaskGraph}.
 * <p>
 * Each loop iteration drains external signals, then works the first runnable leaf of the
 * tree: one Plan/Execute/Verify attempt through the {@link AttemptGraph}, followed by the
 * settlement that attempt calls for (success, retry at a higher temperature, decomposition,
 * abandonment or cancellation). The run ends when the root settles.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private static final long SIGNAL_POLL_MS = 250;

    private final RunContext ctx;
    private final TaskGraph graph;
    private final AttemptGraph attemptGraph;
    private final AgentRoster roster;
    private final MemoryStore memory;
    private final MemoryProperties memoryProperties;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final EventBus eventBus;
    private final OrchestratorProperties properties;
    private final TemperatureSchedule temperatures;

    Orchestrator(RunContext ctx, AttemptGraph attemptGraph, AgentRoster roster, MemoryStore memory,
                 MemoryProperties memoryProperties, AuditLog auditLog, KeystoneMetrics metrics,
                 EventBus eventBus, OrchestratorProperties properties) {
        this.ctx = ctx;
        this.graph = ctx.graph();
        this.attemptGraph = attemptGraph;
        this.roster = roster;
        this.memory = memory;
        this.memoryProperties = memoryProperties;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.properties = properties;
        this.temperatures = TemperatureSchedule.from(properties.getTemperature());
    }

    /**
     * Runs the loop until the root settles.
     *
     * @return the run's final status
     * @throws FatalRunException on graph corruption or node budget exhaustion; the run is
     *                           marked ABORTED and its state dumped to the audit log first
     */
    public RunStatus run() {
        MdcContext.setRun(ctx.runId());
        try {
            String rootId = graph.rootId();
            while (true) {
                drainSignals();
                if (graph.isSettled(rootId)) {
                    break;
                }
                if (ctx.runToken().isCancelled()) {
                    cancelSubtree(rootId);
                    continue;
                }
                TaskNodeView node = graph.nextActiveLeaf().orElseThrow(() -> new FatalRunException(ctx.runId(),
                        "Root " + rootId + " is unsettled but no node is runnable"));
                step(node);
                publishSnapshot();
            }
            graph.verifyInvariants();
            TaskNodeView root = graph.node(rootId);
            RunStatus status = statusOf(root);
            ctx.finish(status, status == RunStatus.FAILED ? failureOf(root) : null);
            log.info("Run {} finished {} ({} nodes)", ctx.runId(), status, graph.size());
            publishSnapshot();
            return status;
        } catch (FatalRunException e) {
            abort(e);
            throw e;
        } catch (GraphValidationException e) {
            FatalRunException fatal = new FatalRunException(ctx.runId(), "Graph invariant violated: " + e.getMessage(), e);
            abort(fatal);
            throw fatal;
        } catch (RuntimeException e) {
            FatalRunException fatal = new FatalRunException(ctx.runId(), "Run loop failed: " + e.getMessage(), e);
            abort(fatal);
            throw fatal;
        } finally {
            MdcContext.clear();
        }
    }

    // ── One step ─────────────────────────────────────────────────────

    private void step(TaskNodeView node) {
        MdcContext.setNode(ctx.runId(), node.id());
        try {
            if (node.status() == TaskStatus.SUSPENDED) {
                if (node.awaitingFeedback()) {
                    VerificationResult feedback = awaitFeedback(node.id());
                    if (feedback != null) {
                        graph.requeue(node.id(), node.temperature());
                        applyFeedback(node.id(), feedback);
                    }
                } else {
                    graph.requeue(node.id(), temperatures.forAttempt(node.attemptCount()));
                }
                return;
            }
            VerificationResult queued = ctx.takeFeedback(node.id());
            if (queued != null) {
                applyFeedback(node.id(), queued);
                return;
            }
            attempt(node);
        } finally {
            MdcContext.clearNode();
        }
    }

    private void attempt(TaskNodeView node) {
        String nodeId = node.id();
        transition(nodeId, TaskStatus.ACTIVE);

        Map<String, Object> inputs = new HashMap<>();
        inputs.put(AttemptState.RUN_ID, ctx.runId());
        inputs.put(AttemptState.NODE_ID, nodeId);
        inputs.put(AttemptState.GOAL, node.goal());
        inputs.put(AttemptState.CONTEXT_STACK, node.contextStack());
        inputs.put(AttemptState.REJECTIONS, node.rejections());
        inputs.put(AttemptState.TEMPERATURE, node.temperature());
        inputs.put(AttemptState.CONSTRAINTS, node.constraints());
        inputs.put(AttemptState.STRATEGY, node.strategy());
        inputs.put(AttemptState.INTENTS, node.plannedCalls());
        if (!node.hasStrategy()) {
            inputs.put(AttemptState.MEMORY_HITS, memory.recall(node.goal(), memoryProperties.getTopK()));
        }
        String sessionToken = ctx.sessionToken(nodeId);
        if (sessionToken != null) {
            inputs.put(AttemptState.SESSION_TOKEN, sessionToken);
        }

        log.info("Attempt {} on node {} (temperature {})", node.attemptCount() + 1, nodeId,
                String.format("%.2f", node.temperature()));
        AttemptState result;
        try (CancellationToken token = ctx.runToken().child()) {
            ctx.beginAttempt(nodeId, token);
            result = attemptGraph.run(inputs, token);
        } finally {
            ctx.endAttempt();
        }

        result.resultBundle().ifPresent(this::countToolCalls);
        ctx.rememberSessionToken(nodeId, result.sessionToken());
        if (!node.hasStrategy() && !result.strategy().isBlank()) {
            graph.assignStrategy(nodeId, result.strategy(), result.intents());
        }

        AttemptOutcome outcome = result.outcome().orElse(AttemptOutcome.REJECTED);
        String rationale = result.rationale().isBlank() ? "attempt ended without a verdict" : result.rationale();
        settle(nodeId, outcome, rationale, result.remediation(), "verifier");
    }

    private void applyFeedback(String nodeId, VerificationResult feedback) {
        transition(nodeId, TaskStatus.ACTIVE);
        auditLog.append(ctx.runId(), nodeId, AuditActors.HUMAN, "feedback",
                Map.of("verdict", feedback.verdict().name(), "rationale", feedback.rationale()),
                feedback.verdict().name().toLowerCase(), feedback.fullRationale());
        settle(nodeId, VerifyNode.outcomeOf(feedback.verdict()), feedback.rationale(), feedback.remediation(), "human");
    }

    private void settle(String nodeId, AttemptOutcome outcome, String rationale, String remediation, String source) {
        switch (outcome) {
            case APPROVED -> succeed(nodeId);
            case REJECTED -> reject(nodeId, VerificationResult.reject(rationale, remediation), source);
            case NEED_MORE_INFO -> {
                transition(nodeId, TaskStatus.FAILED);
                graph.awaitFeedback(nodeId, rationale);
                eventBus.publish(KeystoneEvent.of("node.awaiting_feedback", ctx.runId(), nodeId,
                        Map.of("question", rationale)));
            }
            case ABORTED -> {
                transition(nodeId, TaskStatus.FAILED);
                abandon(nodeId, rationale, "denied");
            }
            case CANCELLED -> cancelSubtree(ctx.runToken().isCancelled() ? graph.rootId() : nodeId);
        }
    }

    // ── Settlement ───────────────────────────────────────────────────

    private void succeed(String nodeId) {
        transition(nodeId, TaskStatus.SUCCESS);
        TaskNodeView node = graph.node(nodeId);
        memory.record(StrategyRecord.of(node.goal(), StrategyOutcome.SUCCESS,
                node.hasStrategy() ? node.strategy() : "approved without a recorded strategy"));
        recordSettle(node, "success");
        propagate(nodeId);
    }

    private void reject(String nodeId, VerificationResult rejection, String source) {
        transition(nodeId, TaskStatus.FAILED);
        ctx.countReject();
        metrics.incrementRejects(source);
        int attempts = graph.recordRejection(nodeId, rejection.fullRationale());
        if (attempts < properties.getMaxAttempts()) {
            transition(nodeId, TaskStatus.SUSPENDED);
            graph.requeue(nodeId, temperatures.forAttempt(attempts));
            log.info("Node {} rejected ({}/{}), retrying: {}", nodeId, attempts, properties.getMaxAttempts(),
                    rejection.rationale());
            return;
        }
        log.info("Node {} rejected {} times, decomposing", nodeId, attempts);
        decomposeOrAbandon(graph.node(nodeId));
    }

    private void decomposeOrAbandon(TaskNodeView node) {
        String nodeId = node.id();
        if (node.depth() >= properties.getMaxDepth()) {
            abandon(nodeId, "max_depth: node at depth " + node.depth() + " may not be decomposed further", "max_depth");
            return;
        }

        List<StrategyRecord> failures = memory.recallFailures(node.goal(), memoryProperties.getTopK());
        List<SubgoalProposal> subgoals;
        MdcContext.setAgent(ctx.runId(), nodeId, AuditActors.PLANNER);
        try {
            var request = new DecomposeRequest(ctx.runId(), nodeId, node.goal(), node.contextStack(), failures,
                    node.rejections());
            subgoals = roster.calls().call(AuditActors.PLANNER, ctx.runToken(), () -> roster.planner().decompose(request));
        } catch (RuntimeException e) {
            log.warn("Planner could not decompose node {}: {}", nodeId, e.getMessage(), e);
            auditLog.append(ctx.runId(), nodeId, AuditActors.PLANNER, "propose_subgoals",
                    Map.of("error", String.valueOf(e.getMessage())), "error", e.getMessage());
            abandon(nodeId, "agent_unavailable: decomposition failed: " + e.getMessage(), "agent_unavailable");
            return;
        } finally {
            MdcContext.clearAgent();
        }

        List<SubgoalProposal> proposed = subgoals == null ? List.of() : subgoals;
        auditLog.append(ctx.runId(), nodeId, AuditActors.PLANNER, "propose_subgoals",
                Map.of("subgoals", proposed.stream().map(SubgoalProposal::goal).toList(),
                        "failureHits", failures.size()),
                "ok", proposed.size() + " subgoal(s)");
        if (proposed.size() < properties.getMinSubgoals()) {
            abandon(nodeId, "irreducible: planner proposed " + proposed.size() + " subgoal(s)", "irreducible");
            return;
        }
        if (graph.size() + proposed.size() > properties.getMaxNodes()) {
            throw new FatalRunException(ctx.runId(), "Node budget exhausted: " + graph.size() + " + "
                    + proposed.size() + " exceeds " + properties.getMaxNodes());
        }

        List<String> children = graph.decompose(nodeId, proposed);
        ctx.countDecomposition();
        metrics.incrementDecompositions();
        metrics.recordDecompositionDepth(node.depth() + 1);
        memory.record(StrategyRecord.of(node.goal(), StrategyOutcome.DECOMPOSED,
                "split into: " + proposed.stream().map(SubgoalProposal::goal).collect(Collectors.joining("; "))));
        recordSettle(graph.node(nodeId), MemoryConsolidationJob.DECOMPOSED_OUTCOME);
        log.info("Node {} decomposed into {}", nodeId, children);
        eventBus.publish(KeystoneEvent.of("node.decomposed", ctx.runId(), nodeId, Map.of("children", children)));
    }

    private void abandon(String nodeId, String reason, String reasonTag) {
        graph.abandon(nodeId, reason);
        metrics.incrementAbandoned(reasonTag);
        TaskNodeView node = graph.node(nodeId);
        memory.record(StrategyRecord.of(node.goal(), StrategyOutcome.FAILED, reason));
        recordSettle(node, "abandoned");
        log.warn("Node {} abandoned: {}", nodeId, reason);
        propagate(nodeId);
    }

    /**
     * Re-evaluates DECOMPOSED ancestors once all their children are settled: SUCCESS when
     * every child succeeded, otherwise FAILED (final).
     */
    private void propagate(String nodeId) {
        String parentId = graph.node(nodeId).parentId();
        while (parentId != null) {
            TaskNodeView parent = graph.node(parentId);
            if (parent.status() != TaskStatus.DECOMPOSED) {
                return;
            }
            List<TaskNodeView> children = graph.children(parentId);
            if (!children.stream().allMatch(TaskNodeView::isSettled)) {
                return;
            }
            if (children.stream().allMatch(c -> c.status() == TaskStatus.SUCCESS)) {
                transition(parentId, TaskStatus.SUCCESS);
                String goldenPath = goldenPath(parentId);
                memory.record(StrategyRecord.of(parent.goal(), StrategyOutcome.SUCCESS, goldenPath));
                TaskNodeView settled = graph.node(parentId);
                auditLog.append(ctx.runId(), parentId, AuditActors.ORCHESTRATOR, MemoryConsolidationJob.SETTLE_ACTION,
                        Map.of("status", settled.status().name(), "goldenPath", goldenPath), "success",
                        settled.goal());
            } else {
                transition(parentId, TaskStatus.FAILED);
                TaskNodeView failed = graph.node(parentId);
                String reason = children.stream().filter(c -> c.status() != TaskStatus.SUCCESS)
                        .map(c -> c.id() + " " + (c.status() == TaskStatus.CANCELLED ? "cancelled" : "failed"))
                        .collect(Collectors.joining(", "));
                memory.record(StrategyRecord.of(failed.goal(), StrategyOutcome.FAILED, "children did not succeed: " + reason));
                recordSettle(failed, "failed");
            }
            parentId = parent.parentId();
        }
    }

    /** Strategies of the successful leaves under {@code nodeId}, in tree order. */
    private String goldenPath(String nodeId) {
        return graph.nodes().stream()
                .filter(n -> graph.isInSubtree(nodeId, n.id()))
                .filter(n -> n.children().isEmpty() && n.status() == TaskStatus.SUCCESS && n.hasStrategy())
                .map(n -> n.id() + ": " + n.strategy())
                .collect(Collectors.joining(" -> "));
    }

    private void recordSettle(TaskNodeView node, String label) {
        auditLog.append(ctx.runId(), node.id(), AuditActors.ORCHESTRATOR, MemoryConsolidationJob.SETTLE_ACTION,
                Map.of("status", node.status().name(), "attempts", node.attemptCount()), label, node.goal());
    }

    // ── Signals and cancellation ─────────────────────────────────────

    private void drainSignals() {
        RunSignal signal;
        while ((signal = ctx.pollSignal()) != null) {
            handle(signal);
        }
    }

    private void handle(RunSignal signal) {
        switch (signal.kind()) {
            case CANCEL -> cancelSubtree(signal.nodeId());
            case FEEDBACK -> {
                if (graph.findNode(signal.nodeId()).map(n -> !n.isSettled()).orElse(false)) {
                    ctx.holdFeedback(signal.nodeId(), signal.feedback());
                } else {
                    log.info("Dropping feedback for settled or unknown node {}", signal.nodeId());
                }
            }
        }
    }

    /**
     * Blocks until feedback arrives for a node awaiting it. Signals for other nodes are
     * handled as they come in.
     *
     * @return the feedback, a timeout rejection, or null when the node was cancelled meanwhile
     */
    private VerificationResult awaitFeedback(String nodeId) {
        VerificationResult held = ctx.takeFeedback(nodeId);
        if (held != null) {
            return held;
        }
        long deadline = System.currentTimeMillis() + properties.getFeedbackWait().toMillis();
        log.info("Node {} waiting up to {} for feedback", nodeId, properties.getFeedbackWait());
        try {
            while (true) {
                if (ctx.runToken().isCancelled() || graph.isSettled(nodeId)) {
                    return null;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return VerificationResult.reject("human_feedback_timeout: no feedback within "
                            + properties.getFeedbackWait());
                }
                RunSignal signal = ctx.pollSignal(Math.min(remaining, SIGNAL_POLL_MS));
                if (signal == null) {
                    continue;
                }
                handle(signal);
                held = ctx.takeFeedback(nodeId);
                if (held != null) {
                    return held;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.runToken().cancel();
            return null;
        }
    }

    private void cancelSubtree(String nodeId) {
        if (graph.findNode(nodeId).isEmpty()) {
            log.warn("Cancel for unknown node {}", nodeId);
            return;
        }
        List<String> cancelled = graph.cancelSubtree(nodeId);
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} node(s) under {}", cancelled.size(), nodeId);
            eventBus.publish(KeystoneEvent.of("node.cancelled", ctx.runId(), nodeId, Map.of("nodes", cancelled)));
            propagate(nodeId);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private void transition(String nodeId, TaskStatus next) {
        TaskStatus from = graph.node(nodeId).status();
        graph.transition(nodeId, next);
        eventBus.publish(KeystoneEvent.of("node.transition", ctx.runId(), nodeId,
                Map.of("from", from.name(), "to", next.name())));
    }

    private void countToolCalls(ResultBundle bundle) {
        int timeouts = (int) bundle.results().stream().filter(ToolInvocationResult::timedOut).count();
        ctx.countToolCalls(bundle.results().size(), timeouts);
    }

    private void publishSnapshot() {
        RunSnapshot snapshot = snapshot();
        eventBus.publish(KeystoneEvent.of("run.snapshot", ctx.runId(), snapshot.activeNode(),
                Map.of("snapshot", snapshot)));
    }

    RunSnapshot snapshot() {
        return ctx.snapshot(auditLog.tail(ctx.runId(), properties.getSnapshotLogLines()));
    }

    private void abort(FatalRunException e) {
        log.error("Run {} aborted: {}", ctx.runId(), e.getMessage(), e);
        ctx.runToken().cancel();
        ctx.finish(RunStatus.ABORTED, e.getMessage());
        try {
            auditLog.append(ctx.runId(), null, AuditActors.ORCHESTRATOR, "fatal_dump",
                    Map.of("tree", graph.nodes(), "error", String.valueOf(e.getMessage())),
                    "aborted", e.getMessage());
        } catch (RuntimeException dumpFailure) {
            log.error("Could not dump state of run {}: {}", ctx.runId(), dumpFailure.getMessage(), dumpFailure);
        }
        eventBus.publish(KeystoneEvent.of("run.aborted", ctx.runId(), null, Map.of("error", String.valueOf(e.getMessage()))));
    }

    private static String failureOf(TaskNodeView root) {
        return root.failureReason() != null ? root.failureReason() : "one or more subgoals did not succeed";
    }

    static RunStatus statusOf(TaskNodeView root) {
        return switch (root.status()) {
            case SUCCESS -> RunStatus.SUCCEEDED;
            case CANCELLED -> RunStatus.CANCELLED;
            case FAILED -> root.finalFailure() ? RunStatus.FAILED : RunStatus.RUNNING;
            default -> RunStatus.RUNNING;
        };
    }
}
