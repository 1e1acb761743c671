package com.keystone.core.llm;

/**
 * The model answered with no content at all.
 */
public class LlmEmptyResponseException extends LlmException {

    public LlmEmptyResponseException(Class<?> targetType) {
        super(targetType, "LLM returned empty content for " + targetType.getSimpleName()
                + "; check that the model is reachable and supports JSON output", null);
    }
}
