package com.keystone.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Append-only ledger of every decision and action taken during runs.
 * <p>
 * Entries are never mutated or removed. Appends take the write lock; readers
 * (snapshots, diagnostics, memory consolidation) share the read lock.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private final List<AuditEntry> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long nextSequence = 1;

    /**
     * Appends one entry.
     *
     * @param payload any Jackson-serializable value; digested, not stored
     * @return the appended entry
     */
    public AuditEntry append(String runId, String nodeId, String actor, String action,
                             Object payload, String outcome, String detail) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(action, "action");
        String digest = digest(payload);
        lock.writeLock().lock();
        try {
            var entry = new AuditEntry(nextSequence++, Instant.now(), runId, nodeId, actor, action,
                    digest, outcome == null ? "" : outcome, detail == null ? "" : detail);
            entries.add(entry);
            log.debug("audit #{} {} {}/{} {} -> {}", entry.sequence(), runId, actor, action, nodeId, entry.outcome());
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<AuditEntry> entries(String runId) {
        return select(e -> e.runId().equals(runId));
    }

    public List<AuditEntry> entries(String runId, String nodeId) {
        return select(e -> e.runId().equals(runId) && Objects.equals(e.nodeId(), nodeId));
    }

    /**
     * The Plan, Execute and Verify decisions recorded for one node, in order.
     */
    public List<AuditEntry> decisionChain(String runId, String nodeId) {
        return select(e -> e.runId().equals(runId) && Objects.equals(e.nodeId(), nodeId) && e.isDecision());
    }

    /** Entries with a sequence strictly greater than {@code sequence}, across all runs. */
    public List<AuditEntry> since(long sequence) {
        lock.readLock().lock();
        try {
            // sequence n sits at index n-1
            int from = (int) Math.min(Math.max(sequence, 0), entries.size());
            return List.copyOf(entries.subList(from, entries.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The last {@code limit} entries of a run, oldest first. */
    public List<AuditEntry> tail(String runId, int limit) {
        List<AuditEntry> all = entries(runId);
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    public long lastSequence() {
        lock.readLock().lock();
        try {
            return nextSequence - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * SHA-256 over the canonical (key-sorted) JSON rendering of the payload.
     */
    public String digest(Object payload) {
        String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Payload of type {} is not serializable, digesting its string form: {}",
                    payload.getClass().getSimpleName(), e.getMessage());
            canonical = String.valueOf(payload);
        }
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private List<AuditEntry> select(Predicate<AuditEntry> filter) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(filter).toList();
        } finally {
            lock.readLock().unlock();
        }
    }
}
