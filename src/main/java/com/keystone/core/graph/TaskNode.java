package com.keystone.core.graph;

import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.TaskNodeView;
import com.keystone.core.model.TaskStatus;
import com.keystone.core.model.ToolCallIntent;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable node state. Only {@link TaskGraph} touches instances, under its write lock.
 */
final class TaskNode {

    final String id;
    final String parentId;
    final String goal;
    final int depth;
    final List<String> contextStack;
    final TaskConstraints constraints;
    final boolean independent;

    TaskStatus status = TaskStatus.PENDING;
    int attemptCount;
    String strategy = "";
    List<ToolCallIntent> plannedCalls = List.of();
    final List<String> children = new ArrayList<>();
    final List<String> rejections = new ArrayList<>();
    boolean finalFailure;
    String failureReason;
    boolean awaitingFeedback;
    double temperature;

    TaskNode(String id, String parentId, String goal, int depth, List<String> contextStack,
             TaskConstraints constraints, boolean independent, double temperature) {
        this.id = id;
        this.parentId = parentId;
        this.goal = goal;
        this.depth = depth;
        this.contextStack = List.copyOf(contextStack);
        this.constraints = constraints;
        this.independent = independent;
        this.temperature = temperature;
    }

    boolean isSettled() {
        return status.isTerminal() || (status == TaskStatus.FAILED && finalFailure);
    }

    TaskNodeView view() {
        return new TaskNodeView(id, parentId, goal, status, depth, attemptCount, strategy,
                plannedCalls, contextStack, List.copyOf(children), List.copyOf(rejections),
                constraints, independent, finalFailure, failureReason, awaitingFeedback, temperature);
    }
}
