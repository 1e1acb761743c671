package com.keystone.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Run-loop limits and retry tuning, bound from {@code keystone.orchestrator.*}.
 */
@Component
@ConfigurationProperties(prefix = "keystone.orchestrator")
public class OrchestratorProperties {

    /** Rejected attempts on one node before it is decomposed. */
    private int maxAttempts = 3;

    /** Deepest level a decomposition may create; the root is depth 0. */
    private int maxDepth = 5;

    /** Total nodes one run may hold. Exceeding it aborts the run. */
    private int maxNodes = 200;

    private int minSubgoals = 2;

    private Temperature temperature = new Temperature();

    /** How long a node asking for more information waits for human feedback. */
    private Duration feedbackWait = Duration.ofMinutes(5);

    /** Runs executing at the same time. */
    private int runWorkers = 4;

    /** Audit lines carried in each snapshot. */
    private int snapshotLogLines = 50;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
    }

    public int getMinSubgoals() {
        return minSubgoals;
    }

    public void setMinSubgoals(int minSubgoals) {
        this.minSubgoals = minSubgoals;
    }

    public Temperature getTemperature() {
        return temperature;
    }

    public void setTemperature(Temperature temperature) {
        this.temperature = temperature;
    }

    public Duration getFeedbackWait() {
        return feedbackWait;
    }

    public void setFeedbackWait(Duration feedbackWait) {
        this.feedbackWait = feedbackWait;
    }

    public int getRunWorkers() {
        return runWorkers;
    }

    public void setRunWorkers(int runWorkers) {
        this.runWorkers = runWorkers;
    }

    public int getSnapshotLogLines() {
        return snapshotLogLines;
    }

    public void setSnapshotLogLines(int snapshotLogLines) {
        this.snapshotLogLines = snapshotLogLines;
    }

    /**
     * Planning temperature curve: {@code min(base + attempts * step, cap)}.
     */
    public static class Temperature {

        private double base = 0.1;
        private double step = 0.2;
        private double cap = 1.0;

        public double getBase() {
            return base;
        }

        public void setBase(double base) {
            this.base = base;
        }

        public double getStep() {
            return step;
        }

        public void setStep(double step) {
            this.step = step;
        }

        public double getCap() {
            return cap;
        }

        public void setCap(double cap) {
            this.cap = cap;
        }
    }
}
