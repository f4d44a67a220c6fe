package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.model.DetectorId;

/**
 * Standard score of today's event volume against the lookback window:
 * {@code (x - μ) / σ}.
 *
 * @since 1.0.0
 */
public class ZScoreScorer extends EventSeriesScorer {

    private static final long serialVersionUID = 1L;

    public ZScoreScorer(int minHistory) {
        super(DetectorId.Z_SCORE, minHistory);
    }

    @Override
    double compute(double value, double[] history, double mean, double stdDev) {
        return (value - mean) / stdDev;
    }
}
