package com.keystone.core.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a task node, with the legal transitions between states.
 */
public enum TaskStatus {
    PENDING,
    ACTIVE,
    SUCCESS,
    FAILED,
    SUSPENDED,
    DECOMPOSED,
    CANCELLED;

    private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED = Map.of(
            PENDING, EnumSet.of(ACTIVE, CANCELLED),
            ACTIVE, EnumSet.of(SUCCESS, FAILED, CANCELLED),
            FAILED, EnumSet.of(SUSPENDED, DECOMPOSED, CANCELLED),
            SUSPENDED, EnumSet.of(PENDING, CANCELLED),
            DECOMPOSED, EnumSet.of(SUCCESS, FAILED, CANCELLED),
            SUCCESS, EnumSet.noneOf(TaskStatus.class),
            CANCELLED, EnumSet.noneOf(TaskStatus.class)
    );

    public boolean canTransitionTo(TaskStatus next) {
        return ALLOWED.get(this).contains(next);
    }

    /** SUCCESS and CANCELLED never change again. A FAILED node is terminal only once marked final. */
    public boolean isTerminal() {
        return this == SUCCESS || this == CANCELLED;
    }
}
