package com.keystone.broker;

/**
 * Raw reply from a connection before normalization.
 *
 * @param text  concatenated text content
 * @param error whether the server flagged the result as a tool error
 */
public record ToolReply(String text, boolean error) {

    public static ToolReply ok(String text) {
        return new ToolReply(text, false);
    }

    public static ToolReply error(String text) {
        return new ToolReply(text, true);
    }
}
