package com.keystone.core.agent;

import com.keystone.core.model.PlanProposal;
import com.keystone.core.model.SubgoalProposal;

import java.util.List;

/**
 * Proposes how to achieve a goal, and how to split it when direct attempts keep failing.
 * Implementations hold no per-run state and never touch the task graph.
 */
public interface Planner {

    /** Name used by {@code keystone.agents.planner}. */
    String name();

    PlanProposal plan(PlanRequest request);

    /**
     * @return ordered subgoals; fewer than two means the goal cannot be split further
     */
    List<SubgoalProposal> decompose(DecomposeRequest request);
}
