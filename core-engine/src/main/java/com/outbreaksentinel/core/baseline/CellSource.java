package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.MetricCell;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the aggregated cells produced by the ingestion side.
 *
 * <p>
 * Implementations return the latest version of each cell; a cell re-aggregated
 * with more source data replaces the previous one under the same key.
 * </p>
 */
public interface CellSource {

    /**
     * @param cursor exclusive lower bound on the time bucket, or {@code null}
     *               for every cell
     * @return cells with a bucket after {@code cursor}, ordered by key
     */
    List<MetricCell> findAfter(LocalDate cursor);

    /**
     * @param location      location identifier
     * @param fromInclusive first bucket
     * @param toExclusive   bucket after the last one
     * @return the location's cells in the range, oldest first
     */
    List<MetricCell> findRange(String location, LocalDate fromInclusive, LocalDate toExclusive);

    Optional<MetricCell> find(CellKey key);

    /**
     * Pick up cells delivered since the last call. Called once at the start
     * of every run.
     *
     * @return number of cells now available
     */
    default int refresh() {
        return 0;
    }
}
