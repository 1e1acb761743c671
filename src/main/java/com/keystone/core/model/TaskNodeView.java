package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable copy of a task node, handed out by the task graph to readers.
 */
public record TaskNodeView(
        String id,
        String parentId,
        String goal,
        TaskStatus status,
        int depth,
        int attemptCount,
        String strategy,
        List<ToolCallIntent> plannedCalls,
        List<String> contextStack,
        List<String> children,
        List<String> rejections,
        TaskConstraints constraints,
        boolean independent,
        boolean finalFailure,
        String failureReason,
        boolean awaitingFeedback,
        double temperature
) implements Serializable {

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isSettled() {
        return status.isTerminal() || (status == TaskStatus.FAILED && finalFailure);
    }

    public boolean hasStrategy() {
        return strategy != null && !strategy.isBlank();
    }

    public String lastRejection() {
        return rejections.isEmpty() ? null : rejections.get(rejections.size() - 1);
    }
}
