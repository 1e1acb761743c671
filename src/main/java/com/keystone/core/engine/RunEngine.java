package com.keystone.core.engine;

import com.keystone.core.agent.AgentRoster;
import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditEntry;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.graph.AttemptGraph;
import com.keystone.core.graph.TaskGraph;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.memory.MemoryProperties;
import com.keystone.core.memory.MemoryStore;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.TaskNodeView;
import com.keystone.core.model.TaskStatus;
import com.keystone.core.model.VerificationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for runs: accepts goals, gives each its own {@link RunContext} and
 * {@link Orchestrator} on a worker thread, and routes cancellation and feedback into them.
 * <p>
 * Runs are retained after they finish so their snapshots and audit trails stay queryable.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AttemptGraph attemptGraph;
    private final AgentRoster roster;
    private final MemoryStore memory;
    private final MemoryProperties memoryProperties;
    private final AuditLog auditLog;
    private final KeystoneMetrics metrics;
    private final EventBus eventBus;
    private final OrchestratorProperties properties;

    private final ConcurrentHashMap<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final ExecutorService runExecutor;

    public RunEngine(AttemptGraph attemptGraph, AgentRoster roster, MemoryStore memory,
                     MemoryProperties memoryProperties, AuditLog auditLog, KeystoneMetrics metrics,
                     EventBus eventBus, OrchestratorProperties properties) {
        this.attemptGraph = attemptGraph;
        this.roster = roster;
        this.memory = memory;
        this.memoryProperties = memoryProperties;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.properties = properties;
        AtomicInteger threads = new AtomicInteger();
        this.runExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getRunWorkers()), r -> {
            Thread t = new Thread(r, "run-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ── Submission ───────────────────────────────────────────────────

    public String submitGoal(String goal) {
        return submitGoal(goal, null, TaskConstraints.none());
    }

    public String submitGoal(String goal, String runId) {
        return submitGoal(goal, runId, TaskConstraints.none());
    }

    /**
     * Starts a run in the background.
     * <p>
     * Re-submitting an existing {@code runId} with the same goal dispatches nothing and
     * returns the id; a finished run keeps its cached result.
     *
     * @param runId caller-chosen id, or null to generate one
     * @return the run id
     * @throws IllegalArgumentException if the goal is blank
     * @throws IllegalStateException    if {@code runId} is taken by a different goal
     */
    public String submitGoal(String goal, String runId, TaskConstraints constraints) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be blank");
        }
        if (runId != null) {
            RunHandle existing = runs.get(runId);
            if (existing != null) {
                return resubmitted(existing, goal);
            }
        }
        String id = runId != null ? runId : generateRunId();
        var graph = new TaskGraph(id, auditLog, properties.getTemperature().getBase());
        var ctx = new RunContext(id, goal, graph);
        var orchestrator = new Orchestrator(ctx, attemptGraph, roster, memory, memoryProperties, auditLog,
                metrics, eventBus, properties);
        var handle = new RunHandle(ctx, orchestrator, new CompletableFuture<>());

        RunHandle raced = runs.putIfAbsent(id, handle);
        if (raced != null) {
            return resubmitted(raced, goal);
        }
        graph.submitRoot(goal, constraints);

        MdcContext.setRun(id);
        try {
            log.info("Starting run {}: {}", id, goal);
            eventBus.publish(KeystoneEvent.of("run.created", id, graph.rootId(), Map.of("goal", goal)));
        } finally {
            MdcContext.clear();
        }
        runExecutor.execute(() -> execute(handle));
        return id;
    }

    /**
     * Submits a goal and blocks until its run finishes.
     *
     * @throws FatalRunException if the run aborted
     */
    public RunResult runToCompletion(String goal) {
        return await(submitGoal(goal));
    }

    public RunResult runToCompletion(String goal, String runId, TaskConstraints constraints) {
        return await(submitGoal(goal, runId, constraints));
    }

    /**
     * Blocks until the run finishes.
     *
     * @throws FatalRunException   if the run aborted
     * @throws RunNotFoundException if the id is unknown
     */
    public RunResult await(String runId) {
        try {
            return require(runId).result().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof FatalRunException fatal) {
                throw fatal;
            }
            throw e;
        }
    }

    /** Result of a finished run, empty while it is still going. */
    public Optional<RunResult> result(String runId) {
        CompletableFuture<RunResult> future = require(runId).result();
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    // ── Queries ──────────────────────────────────────────────────────

    public RunSnapshot snapshot(String runId) {
        return require(runId).orchestrator().snapshot();
    }

    public List<RunSnapshot> listRuns() {
        return runs.values().stream()
                .map(h -> h.orchestrator().snapshot())
                .sorted(Comparator.comparing(RunSnapshot::runId))
                .toList();
    }

    public List<AuditEntry> auditTrail(String runId) {
        require(runId);
        return auditLog.entries(runId);
    }

    public List<AuditEntry> decisionChain(String runId, String nodeId) {
        require(runId).ctx().graph().node(nodeId);
        return auditLog.decisionChain(runId, nodeId);
    }

    // ── Control ──────────────────────────────────────────────────────

    /**
     * Cancels a whole run. In-flight tool calls receive a best-effort cancel.
     *
     * @return false if the run had already finished
     */
    public boolean cancel(String runId) {
        RunHandle handle = require(runId);
        if (handle.ctx().status().isTerminal()) {
            return false;
        }
        auditLog.append(runId, null, AuditActors.HUMAN, "cancel_run", Map.of(), "requested", null);
        log.info("Cancelling run {}", runId);
        handle.ctx().runToken().cancel();
        return true;
    }

    /**
     * Cancels a node and its descendants. Settled nodes keep their status.
     *
     * @throws com.keystone.core.graph.NodeNotFoundException if the node does not exist
     */
    public boolean cancelNode(String runId, String nodeId) {
        RunHandle handle = require(runId);
        TaskNodeView node = handle.ctx().graph().node(nodeId);
        if (handle.ctx().status().isTerminal() || node.isSettled()) {
            return false;
        }
        auditLog.append(runId, nodeId, AuditActors.HUMAN, "cancel_node", Map.of(), "requested", null);
        handle.ctx().post(RunSignal.cancel(nodeId));
        if (handle.ctx().cancelActiveWithin(nodeId)) {
            log.info("Interrupted active attempt under node {} of run {}", nodeId, runId);
        }
        return true;
    }

    /**
     * Queues external feedback for a pending or suspended node. It is applied exactly as a
     * Verifier verdict would be.
     *
     * @throws IllegalStateException if the node is not PENDING or SUSPENDED
     */
    public void injectFeedback(String runId, String nodeId, VerificationResult feedback) {
        RunHandle handle = require(runId);
        TaskNodeView node = handle.ctx().graph().node(nodeId);
        if (node.status() != TaskStatus.PENDING && node.status() != TaskStatus.SUSPENDED) {
            throw new IllegalStateException("Node " + nodeId + " is " + node.status()
                    + "; feedback is accepted for PENDING or SUSPENDED nodes only");
        }
        log.info("Feedback {} queued for node {} of run {}", feedback.verdict(), nodeId, runId);
        handle.ctx().post(RunSignal.feedback(nodeId, feedback));
    }

    @PreDestroy
    public void shutdown() {
        runs.values().forEach(h -> h.ctx().runToken().cancel());
        runExecutor.shutdownNow();
    }

    /**
     * Generates a unique run ID in the format RUN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }

    // ── Internals ────────────────────────────────────────────────────

    private void execute(RunHandle handle) {
        String runId = handle.ctx().runId();
        MdcContext.setRun(runId);
        try {
            RunStatus status = handle.orchestrator().run();
            metrics.recordRunResult(status.name());
            RunSnapshot snapshot = handle.orchestrator().snapshot();
            eventBus.publish(KeystoneEvent.of(status == RunStatus.FAILED ? "run.failed" : "run.completed", runId, null,
                    Map.of("status", status.name())));
            handle.result().complete(new RunResult(runId, status, snapshot, handle.ctx().error()));
        } catch (FatalRunException e) {
            metrics.recordRunResult(RunStatus.ABORTED.name());
            handle.result().completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Run {} failed outside the run loop: {}", runId, e.getMessage(), e);
            metrics.recordRunResult(RunStatus.ABORTED.name());
            handle.result().completeExceptionally(new FatalRunException(runId, e.getMessage(), e));
        } finally {
            MdcContext.clear();
        }
    }

    private String resubmitted(RunHandle existing, String goal) {
        if (!existing.ctx().goal().equals(goal)) {
            throw new IllegalStateException("Run " + existing.ctx().runId() + " already exists with a different goal");
        }
        log.info("Run {} already submitted; not dispatching again", existing.ctx().runId());
        return existing.ctx().runId();
    }

    private RunHandle require(String runId) {
        RunHandle handle = runId == null ? null : runs.get(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        return handle;
    }

    private record RunHandle(RunContext ctx, Orchestrator orchestrator, CompletableFuture<RunResult> result) {}
}
