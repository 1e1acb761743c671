package com.keystone.core.llm;

/**
 * A model reply that could not become the requested record.
 */
public abstract class LlmException extends RuntimeException {

    private final String targetType;

    protected LlmException(Class<?> targetType, String message, Throwable cause) {
        super(message, cause);
        this.targetType = targetType.getSimpleName();
    }

    /** Simple name of the record the reply was meant to fill. */
    public String getTargetType() {
        return targetType;
    }
}
