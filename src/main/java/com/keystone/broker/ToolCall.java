package com.keystone.broker;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A normalized request to invoke one tool.
 *
 * @param serverHint preferred server id; blank lets the broker resolve the tool by name
 * @param toolName   tool to invoke
 * @param args       JSON-compatible arguments
 * @param deadline   absolute instant after which the call yields TIMEOUT
 */
public record ToolCall(
        String serverHint,
        String toolName,
        Map<String, Object> args,
        Instant deadline
) {

    public ToolCall {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(deadline, "deadline");
        serverHint = serverHint == null ? "" : serverHint;
        args = args == null ? Map.of() : args;
    }

    /** Flat text used by the danger gate and in log lines. */
    public String render() {
        StringBuilder sb = new StringBuilder(toolName);
        args.values().forEach(v -> sb.append(' ').append(v));
        return sb.toString();
    }
}
