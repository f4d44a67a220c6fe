package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.baseline.SeriesStatistics;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.Objects;

/**
 * Base class for the statistical detectors, which all run over the daily
 * total of hospital events and social mentions.
 *
 * <p>
 * Handles the shared input checks: the cell must carry hospital or social
 * data, counts must be non-negative, and the baseline must hold at least
 * {@code minHistory} prior days.
 * </p>
 */
abstract class EventSeriesScorer implements DetectorScorer {

    private static final long serialVersionUID = 1L;

    /** Lower bound on σ, in events/day, so a flat history still yields a finite statistic. */
    static final double MIN_STD_DEV = 1.0;

    private final DetectorId detector;
    private final int minHistory;

    EventSeriesScorer(DetectorId detector, int minHistory) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        if (minHistory < 2) {
            throw new IllegalArgumentException("minHistory must be >= 2 for " + detector + ", got: " + minHistory);
        }
        this.minHistory = minHistory;
    }

    @Override
    public final DetectorId detector() {
        return detector;
    }

    @Override
    public final RawScore score(MetricCell cell, LocationBaseline baseline) {
        Objects.requireNonNull(cell, "MetricCell must not be null");
        Objects.requireNonNull(baseline, "LocationBaseline must not be null");

        if (!cell.hasSource(SourceCategory.HOSPITAL) && !cell.hasSource(SourceCategory.SOCIAL)) {
            return RawScore.invalid("no hospital or social data");
        }
        if (cell.getHospitalEvents() < 0 || cell.getSocialMentions() < 0) {
            return RawScore.invalid("negative event count");
        }
        double[] history = baseline.totalEventSeries();
        if (history.length < minHistory) {
            return RawScore.invalid("insufficient history: " + history.length + " < " + minHistory);
        }

        double mean = SeriesStatistics.mean(history);
        double stdDev = Math.max(SeriesStatistics.stdDev(history, mean), MIN_STD_DEV);
        return RawScore.of(compute(cell.getTotalEvents(), history, mean, stdDev));
    }

    /**
     * @param value   today's total events
     * @param history prior daily totals, oldest first
     * @param mean    mean of {@code history}
     * @param stdDev  standard deviation of {@code history}, floored at {@link #MIN_STD_DEV}
     * @return the raw statistic
     */
    abstract double compute(double value, double[] history, double mean, double stdDev);

    int getMinHistory() {
        return minHistory;
    }
}
