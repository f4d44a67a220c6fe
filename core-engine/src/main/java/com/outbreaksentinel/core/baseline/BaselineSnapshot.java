package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.MetricCell;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only history of every location touched by a run, captured once at
 * run start.
 *
 * <p>
 * Scorers and normalizers only see the snapshot, never the live cell source,
 * so cells arriving while a run is in flight cannot change its results.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant takenAt;
    private final int lookbackDays;
    private final Map<String, List<MetricCell>> historyByLocation;

    public BaselineSnapshot(Instant takenAt, int lookbackDays, Collection<MetricCell> history) {
        this.takenAt = Objects.requireNonNull(takenAt, "takenAt must not be null");
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be >= 1, got: " + lookbackDays);
        }
        this.lookbackDays = lookbackDays;
        Map<String, List<MetricCell>> byLocation = new HashMap<>();
        for (MetricCell cell : history) {
            byLocation.computeIfAbsent(cell.getLocation(), k -> new ArrayList<>()).add(cell);
        }
        byLocation.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.historyByLocation = Collections.unmodifiableMap(byLocation);
    }

    public static BaselineSnapshot empty(Instant takenAt, int lookbackDays) {
        return new BaselineSnapshot(takenAt, lookbackDays, List.of());
    }

    /**
     * Baseline for a cell: same location, bucket in
     * {@code [bucket - lookbackDays, bucket)}.
     *
     * @param location location identifier
     * @param bucket   day being scored
     * @return the location's prior cells inside the lookback window
     */
    public LocationBaseline baselineFor(String location, LocalDate bucket) {
        LocalDate from = bucket.minusDays(lookbackDays);
        List<MetricCell> prior = historyByLocation.getOrDefault(location, List.of()).stream()
                .filter(c -> !c.getTimeBucket().isBefore(from) && c.getTimeBucket().isBefore(bucket))
                .toList();
        return new LocationBaseline(location, bucket, prior);
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public int locationCount() {
        return historyByLocation.size();
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{takenAt=" + takenAt + ", lookbackDays=" + lookbackDays
                + ", locations=" + historyByLocation.size() + '}';
    }
}
