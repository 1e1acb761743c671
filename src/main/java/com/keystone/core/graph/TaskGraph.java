package com.keystone.core.graph;

import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditLog;
import com.keystone.core.model.SubgoalProposal;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.TaskNodeView;
import com.keystone.core.model.TaskStatus;
import com.keystone.core.model.ToolCallIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The task tree of one run and the state machine over its nodes.
 * <p>
 * Node ids are hierarchical: the root is {@code "1"}, its children {@code "1.1"},
 * {@code "1.2"}, and so on. Every mutation appends exactly one audit entry (actor
 * {@code task_graph}) and bumps {@link #version()}. Readers take the read lock and only ever
 * see immutable {@link TaskNodeView} copies; the orchestrator is the single writer.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final String runId;
    private final AuditLog auditLog;
    private final double initialTemperature;

    private final Map<String, TaskNode> nodes = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private String rootId;
    private long version;

    public TaskGraph(String runId, AuditLog auditLog, double initialTemperature) {
        this.runId = runId;
        this.auditLog = auditLog;
        this.initialTemperature = initialTemperature;
    }

    public String runId() {
        return runId;
    }

    // ── Mutations ────────────────────────────────────────────────────

    /**
     * Creates the root node.
     *
     * @throws GraphValidationException if the graph already has a root or the goal is blank
     */
    public String submitRoot(String goal, TaskConstraints constraints) {
        if (goal == null || goal.isBlank()) {
            throw new GraphValidationException("Goal must not be blank");
        }
        return write(() -> {
            if (rootId != null) {
                throw new GraphValidationException("Run " + runId + " already has root " + rootId);
            }
            var root = new TaskNode("1", null, goal, 0, List.of(), constraints == null ? TaskConstraints.none() : constraints,
                    false, initialTemperature);
            nodes.put(root.id, root);
            rootId = root.id;
            record(root.id, "submit_root", Map.of("goal", goal), "PENDING", goal);
            return root.id;
        });
    }

    /**
     * Moves a node to {@code next}.
     *
     * @throws InvalidTransitionException if the move is outside the transition table
     * @throws NodeNotFoundException      if the node does not exist
     */
    public void transition(String nodeId, TaskStatus next) {
        write(() -> {
            applyTransition(require(nodeId), next);
            return null;
        });
    }

    /**
     * Records the Planner's strategy on an active node.
     */
    public void assignStrategy(String nodeId, String strategy, List<ToolCallIntent> intents) {
        write(() -> {
            TaskNode node = require(nodeId);
            if (node.status != TaskStatus.ACTIVE) {
                throw new GraphValidationException("Node " + nodeId + " must be ACTIVE to take a strategy, is " + node.status);
            }
            node.strategy = strategy == null ? "" : strategy;
            node.plannedCalls = intents == null ? List.of() : List.copyOf(intents);
            record(nodeId, "assign_strategy", Map.of("strategy", node.strategy, "calls", node.plannedCalls.size()),
                    "ok", node.strategy);
            return null;
        });
    }

    /**
     * Counts a rejected attempt on a FAILED node: bumps the attempt count, appends the
     * rationale to the history and clears the strategy so the next attempt re-plans.
     *
     * @return the new attempt count
     */
    public int recordRejection(String nodeId, String rationale) {
        return write(() -> {
            TaskNode node = require(nodeId);
            if (node.status != TaskStatus.FAILED || node.finalFailure) {
                throw new GraphValidationException("Node " + nodeId + " must be FAILED (not final) to record a rejection");
            }
            node.attemptCount++;
            node.rejections.add(rationale);
            node.strategy = "";
            node.plannedCalls = List.of();
            record(nodeId, "record_rejection", Map.of("attempt", node.attemptCount, "rationale", rationale),
                    "attempt=" + node.attemptCount, rationale);
            return node.attemptCount;
        });
    }

    /**
     * SUSPENDED → PENDING with a new sampling temperature for the next Plan call.
     */
    public void requeue(String nodeId, double temperature) {
        write(() -> {
            TaskNode node = require(nodeId);
            applyStatus(node, TaskStatus.PENDING);
            node.temperature = temperature;
            node.awaitingFeedback = false;
            record(nodeId, "requeue", Map.of("temperature", temperature), "PENDING",
                    String.format("SUSPENDED->PENDING temperature=%.2f", temperature));
            return null;
        });
    }

    /**
     * FAILED → SUSPENDED, parked until external feedback arrives.
     */
    public void awaitFeedback(String nodeId, String question) {
        write(() -> {
            TaskNode node = require(nodeId);
            applyStatus(node, TaskStatus.SUSPENDED);
            node.awaitingFeedback = true;
            record(nodeId, "await_feedback", Map.of("question", question), "SUSPENDED", question);
            return null;
        });
    }

    /**
     * Replaces a FAILED node by ordered children and marks it DECOMPOSED.
     *
     * @return the child ids, in declared order
     */
    public List<String> decompose(String nodeId, List<SubgoalProposal> subgoals) {
        if (subgoals == null || subgoals.isEmpty()) {
            throw new GraphValidationException("Decomposition of " + nodeId + " needs at least one subgoal");
        }
        return write(() -> {
            TaskNode node = require(nodeId);
            if (node.status != TaskStatus.FAILED || node.finalFailure) {
                throw new InvalidTransitionException(nodeId, node.status, TaskStatus.DECOMPOSED,
                        node.finalFailure ? "node is abandoned" : "only FAILED nodes decompose");
            }
            List<String> stack = new ArrayList<>(node.contextStack);
            stack.add(node.goal);
            List<String> ids = new ArrayList<>();
            int index = node.children.size();
            for (SubgoalProposal subgoal : subgoals) {
                String childId = node.id + "." + (++index);
                var child = new TaskNode(childId, node.id, subgoal.goal(), node.depth + 1, stack,
                        node.constraints, subgoal.independent(), initialTemperature);
                nodes.put(childId, child);
                node.children.add(childId);
                ids.add(childId);
            }
            node.status = TaskStatus.DECOMPOSED;
            node.strategy = "";
            node.plannedCalls = List.of();
            record(nodeId, "decompose",
                    Map.of("children", ids, "goals", subgoals.stream().map(SubgoalProposal::goal).toList()),
                    "DECOMPOSED", "FAILED->DECOMPOSED into " + ids);
            return List.copyOf(ids);
        });
    }

    /**
     * Marks a FAILED node final: it will not be retried or decomposed again.
     */
    public void abandon(String nodeId, String reason) {
        write(() -> {
            TaskNode node = require(nodeId);
            if (node.status != TaskStatus.FAILED) {
                throw new InvalidTransitionException(nodeId, node.status, TaskStatus.FAILED, "only FAILED nodes are abandoned");
            }
            node.finalFailure = true;
            node.failureReason = reason;
            record(nodeId, "abandon", Map.of("reason", reason), "FAILED(final)", reason);
            return null;
        });
    }

    /**
     * Cancels a node and every unsettled descendant. Settled nodes keep their status.
     *
     * @return ids of the nodes that changed to CANCELLED, parents before children
     */
    public List<String> cancelSubtree(String nodeId) {
        return write(() -> {
            require(nodeId);
            List<String> cancelled = new ArrayList<>();
            for (TaskNode node : subtree(nodeId)) {
                if (!node.isSettled()) {
                    applyTransition(node, TaskStatus.CANCELLED);
                    cancelled.add(node.id);
                }
            }
            return cancelled;
        });
    }

    // ── Reads ────────────────────────────────────────────────────────

    /**
     * Left-to-right depth-first search for the first runnable leaf (PENDING or SUSPENDED).
     * Settled subtrees are skipped; children of a DECOMPOSED node are visited in order.
     */
    public Optional<TaskNodeView> nextActiveLeaf() {
        return read(() -> rootId == null ? Optional.<TaskNodeView>empty() : findRunnable(nodes.get(rootId)));
    }

    public TaskNodeView node(String nodeId) {
        return read(() -> require(nodeId).view());
    }

    public Optional<TaskNodeView> findNode(String nodeId) {
        return read(() -> Optional.ofNullable(nodes.get(nodeId)).map(TaskNode::view));
    }

    public List<TaskNodeView> children(String nodeId) {
        return read(() -> require(nodeId).children.stream().map(id -> nodes.get(id).view()).toList());
    }

    /** All nodes in depth-first order. */
    public List<TaskNodeView> nodes() {
        return read(() -> rootId == null ? List.<TaskNodeView>of() : subtree(rootId).stream().map(TaskNode::view).toList());
    }

    public String rootId() {
        return read(() -> rootId);
    }

    public Optional<TaskNodeView> root() {
        return read(() -> Optional.ofNullable(rootId).map(id -> nodes.get(id).view()));
    }

    public boolean isSettled(String nodeId) {
        return read(() -> require(nodeId).isSettled());
    }

    /** True when {@code nodeId} is {@code ancestorId} or lies beneath it. */
    public boolean isInSubtree(String ancestorId, String nodeId) {
        if (ancestorId == null || nodeId == null) {
            return false;
        }
        return nodeId.equals(ancestorId) || nodeId.startsWith(ancestorId + ".");
    }

    public int size() {
        return read(nodes::size);
    }

    public long version() {
        return read(() -> version);
    }

    /**
     * Checks the structural invariants: one root, no cycles, every parent present,
     * every DECOMPOSED node has children, SUCCESS parents only over successful children.
     *
     * @throws GraphValidationException on the first violation
     */
    public void verifyInvariants() {
        read(() -> {
            long roots = nodes.values().stream().filter(n -> n.parentId == null).count();
            if (!nodes.isEmpty() && roots != 1) {
                throw new GraphValidationException("Expected exactly one root, found " + roots);
            }
            for (TaskNode node : nodes.values()) {
                if (node.parentId != null && !nodes.containsKey(node.parentId)) {
                    throw new GraphValidationException("Node " + node.id + " has missing parent " + node.parentId);
                }
                if (node.status == TaskStatus.DECOMPOSED && node.children.isEmpty()) {
                    throw new GraphValidationException("DECOMPOSED node " + node.id + " has no children");
                }
                if (node.status == TaskStatus.SUCCESS && !node.children.isEmpty()
                        && !allChildrenSucceeded(node)) {
                    throw new GraphValidationException("SUCCESS node " + node.id + " has unsuccessful children");
                }
                Set<String> seen = new HashSet<>();
                for (String cursor = node.id; cursor != null; cursor = nodes.get(cursor).parentId) {
                    if (!seen.add(cursor)) {
                        throw new GraphValidationException("Cycle through node " + cursor);
                    }
                }
            }
            return null;
        });
    }

    // ── Internals ────────────────────────────────────────────────────

    private void applyTransition(TaskNode node, TaskStatus next) {
        TaskStatus from = node.status;
        if (next == TaskStatus.DECOMPOSED) {
            throw new InvalidTransitionException(node.id, from, next, "use decompose()");
        }
        applyStatus(node, next);
        if (next == TaskStatus.FAILED && from == TaskStatus.DECOMPOSED) {
            node.finalFailure = true;
        }
        if (next != TaskStatus.SUSPENDED) {
            node.awaitingFeedback = false;
        }
        record(node.id, "transition", Map.of("from", from.name(), "to", next.name()), next.name(), from + "->" + next);
    }

    private void applyStatus(TaskNode node, TaskStatus next) {
        TaskStatus from = node.status;
        if (from == TaskStatus.FAILED && node.finalFailure) {
            throw new InvalidTransitionException(node.id, from, next, "node is abandoned");
        }
        if (!from.canTransitionTo(next)) {
            throw new InvalidTransitionException(node.id, from, next, null);
        }
        if (from == TaskStatus.DECOMPOSED && next == TaskStatus.SUCCESS && !allChildrenSucceeded(node)) {
            throw new InvalidTransitionException(node.id, from, next, "not every child succeeded");
        }
        if (next == TaskStatus.ACTIVE && !node.children.isEmpty()) {
            throw new InvalidTransitionException(node.id, from, next, "node has children");
        }
        node.status = next;
        log.debug("Node {} {} -> {}", node.id, from, next);
    }

    private boolean allChildrenSucceeded(TaskNode node) {
        return node.children.stream().allMatch(id -> nodes.get(id).status == TaskStatus.SUCCESS);
    }

    private Optional<TaskNodeView> findRunnable(TaskNode node) {
        if (node.isSettled()) {
            return Optional.empty();
        }
        if (node.status == TaskStatus.DECOMPOSED) {
            for (String childId : node.children) {
                Optional<TaskNodeView> found = findRunnable(nodes.get(childId));
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (node.status == TaskStatus.PENDING || node.status == TaskStatus.SUSPENDED) {
            return Optional.of(node.view());
        }
        return Optional.empty();
    }

    private List<TaskNode> subtree(String nodeId) {
        List<TaskNode> out = new ArrayList<>();
        collect(nodes.get(nodeId), out);
        return out;
    }

    private void collect(TaskNode node, List<TaskNode> out) {
        out.add(node);
        for (String childId : node.children) {
            collect(nodes.get(childId), out);
        }
    }

    private TaskNode require(String nodeId) {
        TaskNode node = nodeId == null ? null : nodes.get(nodeId);
        if (node == null) {
            throw new NodeNotFoundException(nodeId);
        }
        return node;
    }

    private void record(String nodeId, String action, Map<String, Object> payload, String outcome, String detail) {
        version++;
        auditLog.append(runId, nodeId, AuditActors.TASK_GRAPH, action, payload, outcome, detail);
    }

    private <T> T write(Supplier<T> mutation) {
        lock.writeLock().lock();
        try {
            return mutation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
