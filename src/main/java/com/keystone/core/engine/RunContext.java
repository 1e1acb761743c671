package com.keystone.core.engine;

import com.keystone.core.audit.AuditEntry;
import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.graph.TaskGraph;
import com.keystone.core.model.RunMetrics;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;
import com.keystone.core.model.TaskNodeView;
import com.keystone.core.model.TaskStatus;
import com.keystone.core.model.VerificationResult;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Everything one run owns: its task graph, cancellation tokens, signal inbox and counters.
 * <p>
 * The run loop is the only writer of the graph and of the per-node maps. Other threads
 * post {@link RunSignal}s, trip tokens and read snapshots.
 */
public class RunContext {

    private final String runId;
    private final String goal;
    private final TaskGraph graph;
    private final CancellationToken runToken = CancellationToken.create();
    private final BlockingQueue<RunSignal> inbox = new LinkedBlockingQueue<>();
    private final Instant startedAt = Instant.now();

    // loop thread only
    private final Map<String, VerificationResult> pendingFeedback = new HashMap<>();
    private final Map<String, String> sessionTokens = new HashMap<>();

    private final AtomicInteger toolCalls = new AtomicInteger();
    private final AtomicInteger toolTimeouts = new AtomicInteger();
    private final AtomicInteger rejects = new AtomicInteger();
    private final AtomicInteger decompositions = new AtomicInteger();
    private final AtomicLong statusChanges = new AtomicLong();

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile String error;
    private volatile Instant finishedAt;

    private String activeNodeId;
    private CancellationToken attemptToken;

    public RunContext(String runId, String goal, TaskGraph graph) {
        this.runId = runId;
        this.goal = goal;
        this.graph = graph;
    }

    public String runId() {
        return runId;
    }

    public String goal() {
        return goal;
    }

    public TaskGraph graph() {
        return graph;
    }

    public CancellationToken runToken() {
        return runToken;
    }

    public RunStatus status() {
        return status;
    }

    public String error() {
        return error;
    }

    public void finish(RunStatus status, String error) {
        this.status = status;
        this.error = error;
        this.finishedAt = Instant.now();
        statusChanges.incrementAndGet();
    }

    /** Graph mutations plus run status changes. */
    public long version() {
        return graph.version() + statusChanges.get();
    }

    // ── Signals ──────────────────────────────────────────────────────

    public void post(RunSignal signal) {
        inbox.add(signal);
    }

    RunSignal pollSignal() {
        return inbox.poll();
    }

    RunSignal pollSignal(long timeoutMs) throws InterruptedException {
        return inbox.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void holdFeedback(String nodeId, VerificationResult feedback) {
        pendingFeedback.put(nodeId, feedback);
    }

    VerificationResult takeFeedback(String nodeId) {
        return pendingFeedback.remove(nodeId);
    }

    String sessionToken(String nodeId) {
        return sessionTokens.get(nodeId);
    }

    void rememberSessionToken(String nodeId, String token) {
        if (token != null) {
            sessionTokens.put(nodeId, token);
        }
    }

    // ── Active attempt ───────────────────────────────────────────────

    synchronized void beginAttempt(String nodeId, CancellationToken token) {
        this.activeNodeId = nodeId;
        this.attemptToken = token;
    }

    synchronized void endAttempt() {
        this.activeNodeId = null;
        this.attemptToken = null;
    }

    public synchronized String activeNodeId() {
        return activeNodeId;
    }

    /**
     * Trips the in-flight attempt's token when its node lies in the subtree of {@code ancestorId}.
     *
     * @return true if an attempt was cancelled
     */
    public synchronized boolean cancelActiveWithin(String ancestorId) {
        if (attemptToken != null && graph.isInSubtree(ancestorId, activeNodeId)) {
            attemptToken.cancel();
            return true;
        }
        return false;
    }

    // ── Counters ─────────────────────────────────────────────────────

    void countToolCalls(int calls, int timeouts) {
        toolCalls.addAndGet(calls);
        toolTimeouts.addAndGet(timeouts);
    }

    void countReject() {
        rejects.incrementAndGet();
    }

    void countDecomposition() {
        decompositions.incrementAndGet();
    }

    // ── Snapshot ─────────────────────────────────────────────────────

    public RunSnapshot snapshot(List<AuditEntry> recentEntries) {
        long version = version();
        List<TaskNodeView> tree = graph.nodes();
        List<String> logs = recentEntries.stream().map(RunContext::logLine).toList();
        return new RunSnapshot(runId, version, status, goal, tree, activeNodeId(), logs, metrics(tree), error,
                Instant.now());
    }

    private RunMetrics metrics(List<TaskNodeView> tree) {
        int succeeded = 0;
        int failed = 0;
        int cancelled = 0;
        for (TaskNodeView node : tree) {
            if (node.status() == TaskStatus.SUCCESS) {
                succeeded++;
            } else if (node.status() == TaskStatus.CANCELLED) {
                cancelled++;
            } else if (node.status() == TaskStatus.FAILED && node.finalFailure()) {
                failed++;
            }
        }
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return new RunMetrics(tree.size(), succeeded, failed, cancelled, toolCalls.get(), toolTimeouts.get(),
                rejects.get(), decompositions.get(), end.toEpochMilli() - startedAt.toEpochMilli());
    }

    static String logLine(AuditEntry entry) {
        StringBuilder line = new StringBuilder()
                .append('#').append(entry.sequence())
                .append(' ').append(entry.nodeId() == null ? "-" : entry.nodeId())
                .append(' ').append(entry.actor())
                .append('.').append(entry.action());
        if (entry.outcome() != null && !entry.outcome().isBlank()) {
            line.append(" [").append(entry.outcome()).append(']');
        }
        if (entry.detail() != null && !entry.detail().isBlank()) {
            line.append(' ').append(entry.detail());
        }
        return line.toString();
    }
}
