package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.MetricCell;

import java.io.Serializable;
import java.util.Objects;

/**
 * A cell scheduled for processing, with the number of times it has already
 * been deferred.
 */
public final class CellTask implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MetricCell cell;
    private final int priorDeferrals;

    public CellTask(MetricCell cell, int priorDeferrals) {
        this.cell = Objects.requireNonNull(cell, "cell must not be null");
        if (priorDeferrals < 0) {
            throw new IllegalArgumentException("priorDeferrals must be >= 0, got " + priorDeferrals);
        }
        this.priorDeferrals = priorDeferrals;
    }

    public static CellTask fresh(MetricCell cell) {
        return new CellTask(cell, 0);
    }

    public MetricCell getCell() {
        return cell;
    }

    public CellKey getKey() {
        return cell.getKey();
    }

    public int getPriorDeferrals() {
        return priorDeferrals;
    }

    @Override
    public String toString() {
        return "CellTask{" + cell.getKey() + ", priorDeferrals=" + priorDeferrals + '}';
    }
}
