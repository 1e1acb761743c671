package com.keystone.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A tool call the Planner wants made, before a deadline is attached.
 *
 * @param independent true when the call does not depend on the preceding call's result;
 *                    a run of consecutive independent intents is dispatched concurrently
 */
public record ToolCallIntent(
        String serverHint,
        String toolName,
        Map<String, Object> args,
        boolean independent
) implements Serializable {

    public ToolCallIntent {
        serverHint = serverHint == null ? "" : serverHint;
        args = args == null ? Map.of() : Map.copyOf(args);
    }
}
