package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;

import java.util.Map;
import java.util.TreeMap;

/**
 * Cells waiting for re-evaluation and how often each has been deferred.
 * Thread-safe.
 */
public class DeferralRegistry {

    private final Map<CellKey, Integer> deferrals = new TreeMap<>();

    public synchronized int deferralsOf(CellKey key) {
        return deferrals.getOrDefault(key, 0);
    }

    /** Record one more deferral and return the new count. */
    public synchronized int recordDeferral(CellKey key) {
        return deferrals.merge(key, 1, Integer::sum);
    }

    /** Reinstate a count saved by an earlier process. */
    synchronized void restore(CellKey key, int count) {
        if (count > 0) {
            deferrals.put(key, count);
        }
    }

    /** Forget a cell that reached a final outcome. */
    public synchronized void clear(CellKey key) {
        deferrals.remove(key);
    }

    public synchronized Map<CellKey, Integer> pending() {
        return Map.copyOf(deferrals);
    }

    public synchronized int size() {
        return deferrals.size();
    }
}
