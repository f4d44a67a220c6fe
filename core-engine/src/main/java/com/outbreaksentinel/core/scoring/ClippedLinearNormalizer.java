package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;

/**
 * Linear rescale of {@code [lower, upper]} onto [0,1], clipped at both ends.
 */
public class ClippedLinearNormalizer implements ScoreNormalizer {

    private static final long serialVersionUID = 1L;

    private final double lower;
    private final double upper;

    public ClippedLinearNormalizer(double lower, double upper) {
        if (!(upper > lower)) {
            throw new IllegalArgumentException("upper must exceed lower, got: [" + lower + ", " + upper + "]");
        }
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public double normalize(double raw, LocationBaseline baseline) {
        return rescale(raw, lower, upper);
    }

    static double rescale(double raw, double lower, double upper) {
        if (raw <= lower) {
            return 0.0;
        }
        if (raw >= upper) {
            return 1.0;
        }
        return (raw - lower) / (upper - lower);
    }
}
