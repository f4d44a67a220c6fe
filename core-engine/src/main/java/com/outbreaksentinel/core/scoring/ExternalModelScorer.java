package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.MetricCell;

import java.util.Objects;

/**
 * Adapter for detectors whose model runs outside the pipeline (isolation
 * forest, LSTM autoencoder, forecast residual).
 *
 * <p>
 * The model service attaches its raw output to the cell under the detector
 * name; this scorer only checks that the output is present and finite.
 * </p>
 *
 * @since 1.0.0
 */
public class ExternalModelScorer implements DetectorScorer {

    private static final long serialVersionUID = 1L;

    private final DetectorId detector;

    public ExternalModelScorer(DetectorId detector) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    @Override
    public DetectorId detector() {
        return detector;
    }

    @Override
    public RawScore score(MetricCell cell, LocationBaseline baseline) {
        Objects.requireNonNull(cell, "MetricCell must not be null");
        Double output = cell.getModelOutputs().get(detector.name());
        if (output == null) {
            return RawScore.invalid("no " + detector + " output for cell");
        }
        if (!Double.isFinite(output)) {
            return RawScore.invalid("non-finite " + detector + " output: " + output);
        }
        return RawScore.of(output);
    }
}
