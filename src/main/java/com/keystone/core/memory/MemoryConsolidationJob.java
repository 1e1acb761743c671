package com.keystone.core.memory;

import com.keystone.core.audit.AuditActors;
import com.keystone.core.audit.AuditEntry;
import com.keystone.core.audit.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Distils raw audit entries into lesson records.
 * <p>
 * Each pass reads the entries appended since the previous pass, and for every node that
 * settled for good in that window and collected at least one rejection, writes a
 * {@link StrategyOutcome#LESSON} record listing the rejection rationales. A decomposed node
 * settles twice, once when it is split and again when its children finish; only the second
 * settlement yields a lesson. Skipping passes loses nothing but recall quality.
 */
@Component
public class MemoryConsolidationJob {

    private static final Logger log = LoggerFactory.getLogger(MemoryConsolidationJob.class);

    /** Action written by the orchestrator when a node settles; detail holds the goal. */
    public static final String SETTLE_ACTION = "settle";

    /** Settle outcome of a node handed to its children; not final. */
    public static final String DECOMPOSED_OUTCOME = "decomposed";

    private final AuditLog auditLog;
    private final MemoryStore memoryStore;
    private final MemoryProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long watermark;

    public MemoryConsolidationJob(AuditLog auditLog, MemoryStore memoryStore, MemoryProperties properties) {
        this.auditLog = auditLog;
        this.memoryStore = memoryStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${keystone.memory.consolidation.interval-ms:600000}",
            initialDelayString = "${keystone.memory.consolidation.interval-ms:600000}")
    public void scheduledPass() {
        if (!properties.getConsolidation().isEnabled()) {
            return;
        }
        try {
            consolidate();
        } catch (RuntimeException e) {
            log.warn("Memory consolidation pass failed, will retry next interval: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one pass.
     *
     * @return number of lessons written
     */
    public int consolidate() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Consolidation already running, skipping");
            return 0;
        }
        try {
            List<AuditEntry> window = auditLog.since(watermark);
            if (window.isEmpty()) {
                return 0;
            }
            int lessons = 0;
            Set<String> distilled = new HashSet<>();
            for (AuditEntry entry : window) {
                if (isFinalSettle(entry) && distilled.add(entry.runId() + "/" + entry.nodeId()) && distil(entry)) {
                    lessons++;
                }
            }
            watermark = window.get(window.size() - 1).sequence();
            if (lessons > 0) {
                log.info("Memory consolidation wrote {} lesson(s) from {} audit entries", lessons, window.size());
            }
            return lessons;
        } finally {
            running.set(false);
        }
    }

    private static boolean isFinalSettle(AuditEntry entry) {
        return AuditActors.ORCHESTRATOR.equals(entry.actor()) && SETTLE_ACTION.equals(entry.action())
                && !DECOMPOSED_OUTCOME.equals(entry.outcome());
    }

    private boolean distil(AuditEntry settle) {
        List<String> rationales = auditLog.entries(settle.runId(), settle.nodeId()).stream()
                .filter(e -> "reject".equals(e.outcome()))
                .filter(e -> AuditActors.VERIFIER.equals(e.actor()) || AuditActors.HUMAN.equals(e.actor()))
                .map(AuditEntry::detail)
                .filter(d -> d != null && !d.isBlank())
                .toList();
        if (rationales.isEmpty()) {
            return false;
        }
        String goal = settle.detail();
        String narrative = "Settled " + settle.outcome() + " after " + rationales.size()
                + " rejection(s): " + String.join(" | ", rationales);
        memoryStore.record(StrategyRecord.of(goal, StrategyOutcome.LESSON, narrative));
        auditLog.append(settle.runId(), settle.nodeId(), AuditActors.CONSOLIDATION, "lesson",
                Map.of("goal", goal, "rejections", rationales.size()), "recorded", narrative);
        return true;
    }
}
