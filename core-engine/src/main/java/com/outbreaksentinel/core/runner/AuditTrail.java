package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, in-memory record of the suppressed, deferred and failed cells of
 * recent runs, with their verdict trails.
 */
public class AuditTrail {

    private static final Logger LOG = LoggerFactory.getLogger(AuditTrail.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    /** One audited outcome. */
    public static final class Entry {
        private final String runId;
        private final Instant recordedAt;
        private final CellOutcome outcome;

        Entry(String runId, Instant recordedAt, CellOutcome outcome) {
            this.runId = Objects.requireNonNull(runId, "runId must not be null");
            this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt must not be null");
            this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        }

        public String getRunId() {
            return runId;
        }

        public Instant getRecordedAt() {
            return recordedAt;
        }

        public CellOutcome getOutcome() {
            return outcome;
        }
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public AuditTrail() {
        this(DEFAULT_CAPACITY);
    }

    public AuditTrail(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void record(String runId, Instant at, CellOutcome outcome) {
        switch (outcome.getKind()) {
            case SUPPRESSED, DEFERRED, FAILED -> {
                if (entries.size() == capacity) {
                    entries.removeFirst();
                }
                entries.addLast(new Entry(runId, at, outcome));
                LOG.debug("Audited {} in run {}", outcome, runId);
            }
            default -> {
                // escalations live on the alert, screened-out cells are not audited
            }
        }
    }

    public synchronized List<Entry> forCell(CellKey key) {
        return entries.stream().filter(e -> e.getOutcome().getKey().equals(key)).toList();
    }

    /** Most recent first. */
    public synchronized List<Entry> recent(int limit) {
        List<Entry> result = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<Entry> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }
}
