package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.baseline.SeriesStatistics;

import java.util.Objects;

/**
 * Clipped linear rescale against the location's own history of a model
 * output: {@code [μ, μ + width·σ]} of the prior outputs maps onto [0,1].
 *
 * <p>
 * Falls back to a fixed range while the history holds fewer than
 * {@code minHistory} outputs or has zero spread. The range depends only on
 * the baseline, so the mapping is monotonic for a fixed snapshot.
 * </p>
 */
public class BaselineRangeNormalizer implements ScoreNormalizer {

    private static final long serialVersionUID = 1L;

    private final String outputKey;
    private final int minHistory;
    private final double width;
    private final double fallbackLower;
    private final double fallbackUpper;

    public BaselineRangeNormalizer(String outputKey, int minHistory, double width,
            double fallbackLower, double fallbackUpper) {
        this.outputKey = Objects.requireNonNull(outputKey, "outputKey must not be null");
        if (width <= 0.0 || !(fallbackUpper > fallbackLower)) {
            throw new IllegalArgumentException("Invalid range for " + outputKey);
        }
        this.minHistory = minHistory;
        this.width = width;
        this.fallbackLower = fallbackLower;
        this.fallbackUpper = fallbackUpper;
    }

    @Override
    public double normalize(double raw, LocationBaseline baseline) {
        double[] history = baseline.modelOutputSeries(outputKey);
        if (history.length >= minHistory) {
            double mean = SeriesStatistics.mean(history);
            double stdDev = SeriesStatistics.stdDev(history, mean);
            if (stdDev > 0.0) {
                return ClippedLinearNormalizer.rescale(raw, mean, mean + width * stdDev);
            }
        }
        return ClippedLinearNormalizer.rescale(raw, fallbackLower, fallbackUpper);
    }
}
