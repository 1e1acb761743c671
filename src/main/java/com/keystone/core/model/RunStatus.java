package com.keystone.core.model;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    /** Stopped by a fatal condition; the state dump is in the audit log. */
    ABORTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
