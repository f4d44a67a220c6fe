package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.MetricCell;

import java.io.Serializable;

/**
 * Contract for every anomaly detector the pipeline fuses.
 *
 * <p>
 * A scorer is a pure function of the cell and its baseline: no I/O, no
 * retained state between calls. It reports {@link RawScore#invalid(String)}
 * when the location lacks enough history or the cell has no data for the
 * source the detector needs, and never throws for bad input data.
 * </p>
 *
 * <p>
 * New detectors plug in by implementing this interface and registering with
 * {@link ScorerRegistry}, together with a {@link ScoreNormalizer}.
 * </p>
 */
public interface DetectorScorer extends Serializable {

    /**
     * @return identity of the detector this scorer implements
     */
    DetectorId detector();

    /**
     * @param cell     the cell to score
     * @param baseline the location's prior cells
     * @return raw statistic or an invalid marker with a reason
     */
    RawScore score(MetricCell cell, LocationBaseline baseline);
}
