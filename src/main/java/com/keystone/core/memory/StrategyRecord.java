package com.keystone.core.memory;

import java.io.Serializable;
import java.time.Instant;

/**
 * What happened the last time a goal like this was attempted. Written once when a node
 * settles, read many times by the Planner.
 */
public record StrategyRecord(
        String goalFingerprint,
        String goal,
        StrategyOutcome outcome,
        String narrative,
        Instant recordedAt
) implements Serializable {

    public static StrategyRecord of(String goal, StrategyOutcome outcome, String narrative) {
        return new StrategyRecord(GoalFingerprint.of(goal).value(), goal, outcome, narrative, Instant.now());
    }
}
