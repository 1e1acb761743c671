package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a run. {@code version} grows with every graph mutation and
 * status change, so pollers can skip snapshots they have already seen.
 *
 * @param tree       nodes in depth-first order
 * @param activeNode id of the node being worked on (nullable)
 * @param logs       most recent audit lines of the run
 */
public record RunSnapshot(
        String runId,
        long version,
        RunStatus status,
        String goal,
        List<TaskNodeView> tree,
        String activeNode,
        List<String> logs,
        RunMetrics metrics,
        String error,
        Instant updatedAt
) implements Serializable {}
