package com.keystone.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Process-local {@link MemoryStore}. Concurrent recalls share a read lock; appends take the
 * write lock and drop the oldest record once {@code keystone.memory.max-records} is reached.
 */
@Service
public class InMemoryMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final MemoryProperties properties;
    private final List<StrategyRecord> records = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryMemoryStore(MemoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<StrategyRecord> recall(String goal, int k) {
        return rank(goal, k, r -> true);
    }

    @Override
    public List<StrategyRecord> recallFailures(String goal, int k) {
        return rank(goal, k, r -> r.outcome().isFailure());
    }

    @Override
    public void record(StrategyRecord record) {
        lock.writeLock().lock();
        try {
            records.add(record);
            while (records.size() > Math.max(1, properties.getMaxRecords())) {
                records.remove(0);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Recorded {} strategy for goal '{}'", record.outcome(), record.goal());
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<StrategyRecord> rank(String goal, int k, Predicate<StrategyRecord> filter) {
        if (k <= 0) {
            return List.of();
        }
        GoalFingerprint probe = GoalFingerprint.of(goal);
        List<Scored> scored = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (StrategyRecord record : records) {
                if (!filter.test(record)) {
                    continue;
                }
                boolean exact = record.goalFingerprint().equals(probe.value());
                double similarity = exact ? 1.0 : probe.similarity(GoalFingerprint.of(record.goal()));
                if (exact || similarity >= properties.getMinSimilarity()) {
                    scored.add(new Scored(record, exact, similarity));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return scored.stream()
                .sorted(Comparator.comparing(Scored::exact).reversed()
                        .thenComparing(Comparator.comparingDouble(Scored::similarity).reversed())
                        .thenComparing(s -> s.record().recordedAt(), Comparator.reverseOrder()))
                .limit(k)
                .map(Scored::record)
                .toList();
    }

    private record Scored(StrategyRecord record, boolean exact, double similarity) {}
}
