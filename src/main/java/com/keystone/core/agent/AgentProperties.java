package com.keystone.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Which agent implementation fills each role, bound from {@code keystone.agents.*}.
 */
@Component
@ConfigurationProperties(prefix = "keystone.agents")
public class AgentProperties {

    private String planner = "llm";
    private String executor = "tool";
    private String verifier = "llm";

    /** Sampling temperature for verification calls; planning temperature escalates per attempt. */
    private double verifierTemperature = 0.1;

    /** Size of the pool running independent tool calls of one attempt concurrently. */
    private int executePoolSize = 4;

    public String getPlanner() {
        return planner;
    }

    public void setPlanner(String planner) {
        this.planner = planner;
    }

    public String getExecutor() {
        return executor;
    }

    public void setExecutor(String executor) {
        this.executor = executor;
    }

    public String getVerifier() {
        return verifier;
    }

    public void setVerifier(String verifier) {
        this.verifier = verifier;
    }

    public double getVerifierTemperature() {
        return verifierTemperature;
    }

    public void setVerifierTemperature(double verifierTemperature) {
        this.verifierTemperature = verifierTemperature;
    }

    public int getExecutePoolSize() {
        return executePoolSize;
    }

    public void setExecutePoolSize(int executePoolSize) {
        this.executePoolSize = executePoolSize;
    }
}
