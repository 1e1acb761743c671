package com.keystone.core.agent;

import com.keystone.core.memory.StrategyRecord;

import java.util.List;

public record DecomposeRequest(
        String runId,
        String nodeId,
        String goal,
        List<String> contextStack,
        List<StrategyRecord> failureHits,
        List<String> rejections
) {}
