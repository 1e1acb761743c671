package com.keystone.core.graph;

/**
 * Illegal mutation of a task graph. Raised inside the run loop it is fatal to the run.
 */
public class GraphValidationException extends RuntimeException {

    public GraphValidationException(String message) {
        super(message);
    }
}
