package com.keystone.core.agent;

import com.keystone.core.model.ResultBundle;

/**
 * Carries out a strategy's tool-call intents through the tool broker.
 */
public interface Executor {

    String name();

    ResultBundle execute(ExecutionRequest request);
}
