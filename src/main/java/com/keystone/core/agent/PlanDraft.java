package com.keystone.core.agent;

import java.util.List;
import java.util.Map;

/**
 * Structured LLM output for a plan.
 */
public record PlanDraft(String strategy, List<Step> steps) {

    /**
     * @param server      server id, or empty to let the broker find the tool
     * @param independent true when this step does not need the previous step's result
     */
    public record Step(String server, String tool, Map<String, Object> args, boolean independent) {}
}
