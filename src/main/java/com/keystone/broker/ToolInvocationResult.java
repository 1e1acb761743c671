package com.keystone.broker;

import java.io.Serializable;
import java.time.Duration;

/**
 * Normalized outcome of one tool call. Failures carry an {@link ToolErrorKind}
 * instead of an exception.
 */
public record ToolInvocationResult(
        String serverId,
        String toolName,
        boolean success,
        String payload,
        ToolErrorKind errorKind,
        String errorMessage,
        Duration duration
) implements Serializable {

    public static ToolInvocationResult success(String serverId, String toolName, String payload, Duration duration) {
        return new ToolInvocationResult(serverId, toolName, true, payload, null, null, duration);
    }

    public static ToolInvocationResult failure(String serverId, String toolName, ToolErrorKind kind,
                                               String message, Duration duration) {
        return new ToolInvocationResult(serverId, toolName, false, null, kind, message, duration);
    }

    public boolean timedOut() {
        return errorKind == ToolErrorKind.TIMEOUT;
    }

    public String summary() {
        if (success) {
            return serverId + "/" + toolName + " ok";
        }
        return serverId + "/" + toolName + " " + errorKind.wireName() + ": " + errorMessage;
    }
}
