package com.keystone.core.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryStoreTest {

    private MemoryProperties properties;
    private InMemoryMemoryStore store;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        store = new InMemoryMemoryStore(properties);
    }

    @Test
    @DisplayName("exact fingerprint matches rank ahead of partial matches")
    void exactFirst() {
        store.record(StrategyRecord.of("build docker image for api", StrategyOutcome.SUCCESS, "partial"));
        store.record(StrategyRecord.of("build docker image", StrategyOutcome.SUCCESS, "exact"));

        List<StrategyRecord> hits = store.recall("Build the Docker image", 3);

        assertEquals(2, hits.size());
        assertEquals("exact", hits.get(0).narrative());
    }

    @Test
    @DisplayName("records below the similarity floor are not recalled")
    void similarityFloor() {
        store.record(StrategyRecord.of("write quarterly report", StrategyOutcome.SUCCESS, "unrelated"));
        assertTrue(store.recall("build docker image", 3).isEmpty());
    }

    @Test
    @DisplayName("recall honours k")
    void topK() {
        for (int i = 0; i < 5; i++) {
            store.record(StrategyRecord.of("build docker image", StrategyOutcome.SUCCESS, "run " + i));
        }
        assertEquals(3, store.recall("build docker image", 3).size());
        assertTrue(store.recall("build docker image", 0).isEmpty());
    }

    @Test
    @DisplayName("among equals the newest record comes first")
    void newestFirst() {
        String fingerprint = GoalFingerprint.of("build image").value();
        store.record(new StrategyRecord(fingerprint, "build image", StrategyOutcome.SUCCESS, "old",
                Instant.parse("2026-01-01T00:00:00Z")));
        store.record(new StrategyRecord(fingerprint, "build image", StrategyOutcome.SUCCESS, "new",
                Instant.parse("2026-06-01T00:00:00Z")));

        assertEquals("new", store.recall("build image", 1).get(0).narrative());
    }

    @Test
    @DisplayName("recallFailures skips successes")
    void failuresOnly() {
        store.record(StrategyRecord.of("deploy service", StrategyOutcome.SUCCESS, "worked"));
        store.record(StrategyRecord.of("deploy service", StrategyOutcome.FAILED, "abandoned"));
        store.record(StrategyRecord.of("deploy service", StrategyOutcome.LESSON, "check config first"));

        List<StrategyRecord> failures = store.recallFailures("deploy service", 5);

        assertEquals(2, failures.size());
        assertTrue(failures.stream().allMatch(r -> r.outcome().isFailure()));
    }

    @Test
    @DisplayName("oldest records are dropped beyond the cap")
    void capped() {
        properties.setMaxRecords(2);
        store.record(StrategyRecord.of("a goal", StrategyOutcome.SUCCESS, "first"));
        store.record(StrategyRecord.of("a goal", StrategyOutcome.SUCCESS, "second"));
        store.record(StrategyRecord.of("a goal", StrategyOutcome.SUCCESS, "third"));

        assertEquals(2, store.size());
        assertTrue(store.recall("a goal", 5).stream().noneMatch(r -> r.narrative().equals("first")));
    }
}
