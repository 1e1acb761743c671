package com.keystone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, used for SSE streaming and CLI watch mode.
 *
 * @param eventType event type (e.g. "run.created", "node.transition", "run.snapshot")
 * @param runId     the run this event belongs to
 * @param nodeId    the task node this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record KeystoneEvent(
    String eventType,
    String runId,
    String nodeId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static KeystoneEvent of(String eventType, String runId, String nodeId, Map<String, Object> payload) {
        return new KeystoneEvent(eventType, runId, nodeId, payload == null ? Map.of() : payload, Instant.now());
    }
}
