package com.keystone.core.memory;

public enum StrategyOutcome {
    /** The strategy (or the golden path of a decomposed goal) achieved the goal. */
    SUCCESS,
    /** The goal could not be solved directly and was split into subgoals. */
    DECOMPOSED,
    /** The goal was abandoned. */
    FAILED,
    /** A rejection pattern distilled from the audit log by consolidation. */
    LESSON;

    public boolean isFailure() {
        return this != SUCCESS;
    }
}
