package com.keystone.broker;

/**
 * Recoverable tool failure. The broker converts it into a failed
 * {@link ToolInvocationResult}; it never escapes the run loop.
 */
public class ToolException extends RuntimeException {

    private final ToolErrorKind kind;

    public ToolException(ToolErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ToolException(ToolErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ToolErrorKind getKind() {
        return kind;
    }
}
