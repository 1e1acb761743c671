package com.keystone.core.graph;

import com.keystone.core.model.TaskStatus;

public class InvalidTransitionException extends GraphValidationException {

    private final String nodeId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String nodeId, TaskStatus from, TaskStatus to, String reason) {
        super("Node " + nodeId + ": " + from + " -> " + to + " not allowed" + (reason == null ? "" : " (" + reason + ")"));
        this.nodeId = nodeId;
        this.from = from;
        this.to = to;
    }

    public String getNodeId() {
        return nodeId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
