package com.keystone.core.agent;

import com.keystone.core.memory.StrategyRecord;

import java.util.List;

/**
 * @param memoryHits   similar past strategies, best first
 * @param rejections   rationales of this node's rejected attempts, oldest first
 * @param sessionToken continuity token returned by the previous plan for this node (nullable)
 */
public record PlanRequest(
        String runId,
        String nodeId,
        String goal,
        List<String> contextStack,
        List<StrategyRecord> memoryHits,
        List<String> rejections,
        double temperature,
        String sessionToken
) {}
