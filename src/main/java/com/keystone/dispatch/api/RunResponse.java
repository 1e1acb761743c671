package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.core.model.RunMetrics;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.TaskNodeView;

import java.util.List;

/**
 * JSON response for run endpoints.
 */
public record RunResponse(
    @JsonProperty("run_id") String runId,
    long version,
    String status,
    String goal,
    @JsonProperty("active_node") String activeNode,
    List<NodeResponse> nodes,
    RunMetrics metrics,
    List<String> logs,
    String error,
    @JsonProperty("updated_at") String updatedAt
) {

    public static RunResponse from(RunSnapshot snapshot) {
        return new RunResponse(
                snapshot.runId(),
                snapshot.version(),
                snapshot.status().name(),
                snapshot.goal(),
                snapshot.activeNode(),
                snapshot.tree().stream().map(NodeResponse::from).toList(),
                snapshot.metrics(),
                snapshot.logs(),
                snapshot.error(),
                snapshot.updatedAt() == null ? null : snapshot.updatedAt().toString());
    }

    /**
     * Nested node representation in the run response.
     */
    public record NodeResponse(
        String id,
        @JsonProperty("parent_id") String parentId,
        String goal,
        String status,
        int depth,
        @JsonProperty("attempt_count") int attemptCount,
        String strategy,
        List<String> rejections,
        @JsonProperty("final_failure") boolean finalFailure,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("awaiting_feedback") boolean awaitingFeedback
    ) {

        static NodeResponse from(TaskNodeView node) {
            return new NodeResponse(node.id(), node.parentId(), node.goal(), node.status().name(), node.depth(),
                    node.attemptCount(), node.strategy(), node.rejections(), node.finalFailure(),
                    node.failureReason(), node.awaitingFeedback());
        }
    }
}
