package com.keystone.core.llm;

/**
 * The model's reply was not valid JSON for the target record, even after unwrapping a
 * markdown fence.
 */
public class LlmParseException extends LlmException {

    static final int EXCERPT_LENGTH = 200;

    private final String excerpt;

    public LlmParseException(Class<?> targetType, String reply, Throwable cause) {
        super(targetType, "Failed to parse LLM response to " + targetType.getSimpleName() + ": "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        String flat = reply == null ? "" : reply.strip().replaceAll("\\s+", " ");
        this.excerpt = flat.length() <= EXCERPT_LENGTH ? flat : flat.substring(0, EXCERPT_LENGTH) + "...";
    }

    /** Start of the offending reply, whitespace collapsed, for audit rationales. */
    public String getExcerpt() {
        return excerpt;
    }
}
