package com.keystone.core.agent;

import java.util.List;

/**
 * Structured LLM output for a decomposition.
 */
public record SubgoalDraft(List<Item> subgoals) {

    public record Item(String goal, boolean independent) {}
}
