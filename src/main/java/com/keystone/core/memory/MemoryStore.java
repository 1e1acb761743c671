package com.keystone.core.memory;

import java.util.List;

/**
 * Recall of past strategy outcomes by goal similarity.
 */
public interface MemoryStore {

    /**
     * Top-k records for goals similar to {@code goal}, best first. An exact fingerprint
     * match always ranks ahead of partial matches.
     */
    List<StrategyRecord> recall(String goal, int k);

    /** Like {@link #recall} but only failures, decompositions and lessons. */
    List<StrategyRecord> recallFailures(String goal, int k);

    void record(StrategyRecord record);

    int size();
}
