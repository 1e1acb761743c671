package com.keystone.broker;

/**
 * Normalized failure classes for tool invocations, independent of the backend.
 */
public enum ToolErrorKind {
    /** No enabled server can serve the call. */
    NOT_CONFIGURED,
    /** The call's deadline was reached before the backend answered. */
    TIMEOUT,
    /** The backend failed, crashed, or reported a tool-level error. */
    REMOTE_ERROR,
    /** Arguments do not satisfy the tool's input schema. */
    INVALID_ARGS,
    /** The owning run or node was cancelled while the call was in flight. */
    CANCELLED;

    public String wireName() {
        return name().toLowerCase();
    }
}
