package com.keystone.core.audit;

import java.io.Serializable;
import java.time.Instant;

/**
 * One immutable line of the audit ledger.
 *
 * @param sequence      global, strictly increasing position in the ledger
 * @param timestamp     when the entry was appended
 * @param runId         owning run
 * @param nodeId        task node the decision concerns (nullable for run-level entries)
 * @param actor         who decided or acted, see {@link AuditActors}
 * @param action        what was done (e.g. "plan", "transition", "tool_timeout")
 * @param payloadDigest SHA-256 hex digest of the canonical JSON payload
 * @param outcome       short outcome label
 * @param detail        free-form human readable detail
 */
public record AuditEntry(
        long sequence,
        Instant timestamp,
        String runId,
        String nodeId,
        String actor,
        String action,
        String payloadDigest,
        String outcome,
        String detail
) implements Serializable {

    public boolean isDecision() {
        return AuditActors.DECISION_ACTORS.contains(actor);
    }
}
