package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.MetricCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the per-run {@link BaselineSnapshot} from a {@link CellSource}.
 *
 * <p>
 * For every location among the pending cells it loads the cells between
 * {@code earliest pending bucket - lookbackDays} and the latest pending
 * bucket, which covers the lookback of every cell the run will score.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineStore {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineStore.class);

    private final CellSource source;
    private final int lookbackDays;

    public BaselineStore(CellSource source, int lookbackDays) {
        this.source = Objects.requireNonNull(source, "CellSource must not be null");
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be >= 1, got: " + lookbackDays);
        }
        this.lookbackDays = lookbackDays;
    }

    /**
     * @param pending cells the run is about to score
     * @param takenAt run start time
     * @return a consistent, read-only history for the run
     */
    public BaselineSnapshot snapshot(Collection<MetricCell> pending, Instant takenAt) {
        Map<String, LocalDate[]> ranges = new HashMap<>();
        for (MetricCell cell : pending) {
            ranges.merge(cell.getLocation(),
                    new LocalDate[] { cell.getTimeBucket(), cell.getTimeBucket() },
                    (a, b) -> new LocalDate[] {
                            a[0].isBefore(b[0]) ? a[0] : b[0],
                            a[1].isAfter(b[1]) ? a[1] : b[1] });
        }

        List<MetricCell> history = new ArrayList<>();
        ranges.forEach((location, range) -> history.addAll(
                source.findRange(location, range[0].minusDays(lookbackDays), range[1])));

        LOG.debug("Baseline snapshot: {} location(s), {} historical cell(s)", ranges.size(), history.size());
        return new BaselineSnapshot(takenAt, lookbackDays, history);
    }

    public int getLookbackDays() {
        return lookbackDays;
    }
}
