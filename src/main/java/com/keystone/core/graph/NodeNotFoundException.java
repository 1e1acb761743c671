package com.keystone.core.graph;

public class NodeNotFoundException extends GraphValidationException {

    public NodeNotFoundException(String nodeId) {
        super("No task node with id " + nodeId);
    }
}
