package com.keystone.core.model;

import com.keystone.broker.ToolInvocationResult;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Everything the Executor produced for one attempt.
 *
 * @param aborted     true when a danger-gate denial stopped execution
 * @param cancelled   true when the attempt's cancellation token tripped
 * @param abortReason why execution stopped early (nullable)
 */
public record ResultBundle(
        String strategy,
        List<ToolInvocationResult> results,
        boolean aborted,
        boolean cancelled,
        String abortReason,
        long durationMs
) implements Serializable {

    public ResultBundle {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    public boolean timedOut() {
        return results.stream().anyMatch(ToolInvocationResult::timedOut);
    }

    public Optional<ToolInvocationResult> firstFailure() {
        return results.stream().filter(r -> !r.success()).findFirst();
    }

    public String summary() {
        if (results.isEmpty()) {
            return "no tool calls";
        }
        return String.join("; ", results.stream().map(ToolInvocationResult::summary).toList());
    }
}
