package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.model.DetectorId;

/**
 * Deviation of today's volume from an exponentially weighted moving average
 * of the lookback window, in units of σ.
 *
 * @since 1.0.0
 */
public class EwmaScorer extends EventSeriesScorer {

    private static final long serialVersionUID = 1L;

    private final double alpha;

    /**
     * @param minHistory minimum prior days
     * @param alpha      smoothing factor in (0,1]
     */
    public EwmaScorer(int minHistory, double alpha) {
        super(DetectorId.EWMA, minHistory);
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("EWMA alpha must be in (0,1], got: " + alpha);
        }
        this.alpha = alpha;
    }

    @Override
    double compute(double value, double[] history, double mean, double stdDev) {
        double ewma = history[0];
        for (int i = 1; i < history.length; i++) {
            ewma = alpha * history[i] + (1 - alpha) * ewma;
        }
        return (value - ewma) / stdDev;
    }
}
