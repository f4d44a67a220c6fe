package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The history a scorer may look at for one cell: the prior cells of the same
 * location inside the lookback window, strictly before the cell's bucket, in
 * chronological order.
 *
 * <p>
 * Instances are cut from a {@link BaselineSnapshot} and never change, so
 * every score derived from them is reproducible within a run.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocationBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String location;
    private final LocalDate bucket;
    private final List<MetricCell> priorCells;

    public LocationBaseline(String location, LocalDate bucket, List<MetricCell> priorCells) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
        List<MetricCell> copy = new ArrayList<>(Objects.requireNonNull(priorCells, "priorCells must not be null"));
        copy.sort((a, b) -> a.getTimeBucket().compareTo(b.getTimeBucket()));
        for (MetricCell cell : copy) {
            if (!cell.getTimeBucket().isBefore(bucket)) {
                throw new IllegalArgumentException("Baseline for " + location + "@" + bucket
                        + " must not contain cell " + cell.getKey());
            }
        }
        this.priorCells = Collections.unmodifiableList(copy);
    }

    /**
     * @param location location identifier
     * @param bucket   day being scored
     * @return a baseline with no history
     */
    public static LocationBaseline empty(String location, LocalDate bucket) {
        return new LocationBaseline(location, bucket, List.of());
    }

    public String getLocation() {
        return location;
    }

    public LocalDate getBucket() {
        return bucket;
    }

    public List<MetricCell> getPriorCells() {
        return priorCells;
    }

    public int size() {
        return priorCells.size();
    }

    /**
     * @return total hospital + social events per prior day
     */
    public double[] totalEventSeries() {
        return priorCells.stream().mapToDouble(MetricCell::getTotalEvents).toArray();
    }

    /**
     * Daily volume of one source category, over the prior days on which that
     * category reported.
     *
     * @param category hospital or social
     * @return per-day counts
     * @throws IllegalArgumentException for the environment category
     */
    public double[] categorySeries(SourceCategory category) {
        return switch (category) {
            case HOSPITAL -> priorCells.stream()
                    .filter(c -> c.hasSource(SourceCategory.HOSPITAL))
                    .mapToDouble(MetricCell::getHospitalEvents)
                    .toArray();
            case SOCIAL -> priorCells.stream()
                    .filter(c -> c.hasSource(SourceCategory.SOCIAL))
                    .mapToDouble(MetricCell::getSocialMentions)
                    .toArray();
            case ENVIRONMENT -> throw new IllegalArgumentException(
                    "Environment readings have no count series");
        };
    }

    /**
     * Raw outputs a model service attached to prior cells.
     *
     * @param detector model output key
     * @return the finite outputs, oldest first
     */
    public double[] modelOutputSeries(String detector) {
        return priorCells.stream()
                .map(c -> c.getModelOutputs().get(detector))
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .filter(Double::isFinite)
                .toArray();
    }

    @Override
    public String toString() {
        return "LocationBaseline{" + location + "@" + bucket + ", priorCells=" + priorCells.size() + '}';
    }
}
