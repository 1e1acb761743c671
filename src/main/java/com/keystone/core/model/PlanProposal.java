package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Planner output for one attempt.
 *
 * @param sessionToken opaque continuity token handed back on the next call (nullable)
 */
public record PlanProposal(String strategy, List<ToolCallIntent> intents, String sessionToken)
        implements Serializable {

    public PlanProposal {
        if (strategy == null || strategy.isBlank()) {
            throw new IllegalArgumentException("strategy must not be blank");
        }
        intents = intents == null ? List.of() : List.copyOf(intents);
    }
}
