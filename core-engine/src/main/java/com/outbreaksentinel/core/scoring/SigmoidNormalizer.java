package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;

/**
 * {@code tanh(max(0, raw) / scale)}: zero for non-positive statistics,
 * approaching 1 as the statistic grows. Used for z-like statistics.
 */
public class SigmoidNormalizer implements ScoreNormalizer {

    private static final long serialVersionUID = 1L;

    private final double scale;

    /**
     * @param scale raw value at which the output reaches {@code tanh(1) ≈ 0.76}
     */
    public SigmoidNormalizer(double scale) {
        if (!(scale > 0.0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("scale must be positive and finite, got: " + scale);
        }
        this.scale = scale;
    }

    @Override
    public double normalize(double raw, LocationBaseline baseline) {
        return Math.tanh(Math.max(0.0, raw) / scale);
    }

    public double getScale() {
        return scale;
    }
}
