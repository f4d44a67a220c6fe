package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;

import java.io.Serializable;

/**
 * Maps one detector's raw statistic onto the common [0,1] anomaly scale.
 *
 * <p>
 * Implementations must be monotonic non-decreasing in {@code raw} for a fixed
 * baseline, return 0 for "no anomaly", and never leave [0,1]. They are pure:
 * the same raw value and baseline always map to the same result.
 * </p>
 */
public interface ScoreNormalizer extends Serializable {

    /**
     * @param raw      finite raw statistic
     * @param baseline the location's history at run start
     * @return normalized score in [0,1]
     */
    double normalize(double raw, LocationBaseline baseline);
}
