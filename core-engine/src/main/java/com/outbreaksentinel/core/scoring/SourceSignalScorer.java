package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.baseline.SeriesStatistics;
import com.outbreaksentinel.core.model.EnvironmentReading;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-category anomaly signals used for cross-source corroboration.
 *
 * <ul>
 * <li>hospital / social: {@code tanh(max(0, z) / 4)} of the category's own
 * daily count against its history; no signal while history is short</li>
 * <li>environment: vector index / 10</li>
 * </ul>
 *
 * <p>
 * A category only produces a signal when the cell's provenance flags mark it
 * present and its values are in range.
 * </p>
 */
public class SourceSignalScorer {

    static final double SIGNAL_SCALE = 4.0;
    static final double MAX_VECTOR_INDEX = 10.0;

    private final int minHistory;

    public SourceSignalScorer(int minHistory) {
        this.minHistory = minHistory;
    }

    /**
     * @return categories the provenance flags mark present
     */
    public Set<SourceCategory> sourcesWithData(MetricCell cell) {
        Set<SourceCategory> present = EnumSet.noneOf(SourceCategory.class);
        present.addAll(cell.getSources());
        return present;
    }

    /**
     * @param cell     the cell
     * @param baseline the location's prior cells
     * @return signal in [0,1] per category that could be scored
     */
    public Map<SourceCategory, Double> signals(MetricCell cell, LocationBaseline baseline) {
        Map<SourceCategory, Double> signals = new EnumMap<>(SourceCategory.class);
        if (cell.hasSource(SourceCategory.HOSPITAL) && cell.getHospitalEvents() >= 0) {
            countSignal(cell.getHospitalEvents(), baseline.categorySeries(SourceCategory.HOSPITAL))
                    .ifPresent(s -> signals.put(SourceCategory.HOSPITAL, s));
        }
        if (cell.hasSource(SourceCategory.SOCIAL) && cell.getSocialMentions() >= 0) {
            countSignal(cell.getSocialMentions(), baseline.categorySeries(SourceCategory.SOCIAL))
                    .ifPresent(s -> signals.put(SourceCategory.SOCIAL, s));
        }
        EnvironmentReading env = cell.getEnvironment();
        if (cell.hasSource(SourceCategory.ENVIRONMENT) && env != null && env.getVectorIndex() != null) {
            double index = env.getVectorIndex();
            if (Double.isFinite(index) && index >= 0.0 && index <= MAX_VECTOR_INDEX) {
                signals.put(SourceCategory.ENVIRONMENT, index / MAX_VECTOR_INDEX);
            }
        }
        return signals;
    }

    private Optional<Double> countSignal(double value, double[] history) {
        if (history.length < minHistory) {
            return Optional.empty();
        }
        double mean = SeriesStatistics.mean(history);
        double stdDev = Math.max(SeriesStatistics.stdDev(history, mean), EventSeriesScorer.MIN_STD_DEV);
        double z = (value - mean) / stdDev;
        return Optional.of(Math.tanh(Math.max(0.0, z) / SIGNAL_SCALE));
    }
}
