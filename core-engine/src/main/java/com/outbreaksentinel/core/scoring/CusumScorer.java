package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.model.DetectorId;

/**
 * One-sided (upper) tabular CUSUM over standardized daily volume.
 *
 * <p>
 * {@code S_t = max(0, S_{t-1} + z_t - k)} is accumulated across the lookback
 * window and then today's value; the raw score is the final {@code S}. A
 * sustained rise accumulates even when no single day is extreme.
 * </p>
 *
 * @since 1.0.0
 */
public class CusumScorer extends EventSeriesScorer {

    private static final long serialVersionUID = 1L;

    private final double slack;

    /**
     * @param minHistory minimum prior days
     * @param slack      allowance {@code k} in units of σ
     */
    public CusumScorer(int minHistory, double slack) {
        super(DetectorId.CUSUM, minHistory);
        if (slack < 0) {
            throw new IllegalArgumentException("CUSUM slack must be >= 0, got: " + slack);
        }
        this.slack = slack;
    }

    @Override
    double compute(double value, double[] history, double mean, double stdDev) {
        double s = 0.0;
        for (double v : history) {
            s = Math.max(0.0, s + (v - mean) / stdDev - slack);
        }
        return Math.max(0.0, s + (value - mean) / stdDev - slack);
    }
}
