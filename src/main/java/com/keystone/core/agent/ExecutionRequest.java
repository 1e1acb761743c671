package com.keystone.core.agent;

import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.ToolCallIntent;

import java.util.List;

public record ExecutionRequest(
        String runId,
        String nodeId,
        String goal,
        String strategy,
        List<ToolCallIntent> intents,
        TaskConstraints constraints,
        CancellationToken token
) {}
