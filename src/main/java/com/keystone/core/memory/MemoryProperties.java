package com.keystone.core.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for strategy memory, bound from {@code keystone.memory.*}.
 */
@Component
@ConfigurationProperties(prefix = "keystone.memory")
public class MemoryProperties {

    /** Records returned per recall. */
    private int topK = 3;

    /** Oldest records are dropped beyond this many. */
    private int maxRecords = 5000;

    /** Records below this similarity are never returned. */
    private double minSimilarity = 0.2;

    private Consolidation consolidation = new Consolidation();

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public void setMinSimilarity(double minSimilarity) {
        this.minSimilarity = minSimilarity;
    }

    public Consolidation getConsolidation() {
        return consolidation;
    }

    public void setConsolidation(Consolidation consolidation) {
        this.consolidation = consolidation;
    }

    public static class Consolidation {

        private boolean enabled = true;

        /** Delay between consolidation passes, in milliseconds. */
        private long intervalMs = 600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
