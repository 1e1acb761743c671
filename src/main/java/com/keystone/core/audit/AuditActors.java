package com.keystone.core.audit;

import java.util.Set;

/**
 * Actor names written into {@link AuditEntry#actor()}.
 */
public final class AuditActors {

    public static final String TASK_GRAPH = "task_graph";
    public static final String ORCHESTRATOR = "orchestrator";
    public static final String PLANNER = "planner";
    public static final String EXECUTOR = "executor";
    public static final String VERIFIER = "verifier";
    public static final String TOOL_BROKER = "tool_broker";
    public static final String HUMAN = "human";
    public static final String DANGER_GATE = "danger_gate";
    public static final String CONSOLIDATION = "consolidation";

    /** Actors whose entries make up a node's decision chain. */
    public static final Set<String> DECISION_ACTORS = Set.of(PLANNER, EXECUTOR, VERIFIER);

    private AuditActors() {}
}
