package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.ScoreContractViolation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One {@link ScoreNormalizer} per detector, applied by
 * {@link #normalize(DetectorId, double, LocationBaseline)}.
 *
 * <h3>Built-in calibration</h3>
 * <ul>
 * <li>{@code z_score}: tanh squash, scale 4</li>
 * <li>{@code ewma}, {@code prophet_residual}: tanh squash, scale 3</li>
 * <li>{@code cusum}: clipped linear over [0, 5]</li>
 * <li>{@code isolation_forest}: clipped linear over [0.5, 1.0] (path-length score)</li>
 * <li>{@code lstm_autoencoder}: [μ, μ + 3σ] of the location's past
 * reconstruction errors, fixed [0, 1] while history is short</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class NormalizerRegistry {

    private final Map<DetectorId, ScoreNormalizer> normalizers;

    private NormalizerRegistry(Map<DetectorId, ScoreNormalizer> normalizers) {
        this.normalizers = Collections.unmodifiableMap(normalizers);
    }

    /**
     * @throws IllegalArgumentException if the detector is not built in
     */
    public static ScoreNormalizer create(DetectorId detector, PipelineSettings.Scoring scoring) {
        Objects.requireNonNull(detector, "DetectorId must not be null");
        return switch (detector.name()) {
            case "z_score" -> new SigmoidNormalizer(4.0);
            case "ewma", "prophet_residual" -> new SigmoidNormalizer(3.0);
            case "cusum" -> new ClippedLinearNormalizer(0.0, 5.0);
            case "isolation_forest" -> new ClippedLinearNormalizer(0.5, 1.0);
            case "lstm_autoencoder" -> new BaselineRangeNormalizer(
                    detector.name(), scoring.getLstmMinHistory(), 3.0, 0.0, 1.0);
            default -> throw new IllegalArgumentException(
                    "No built-in normalizer for detector '" + detector + "'");
        };
    }

    public static NormalizerRegistry forDetectors(Collection<DetectorId> detectors, PipelineSettings.Scoring scoring) {
        Map<DetectorId, ScoreNormalizer> map = new LinkedHashMap<>();
        for (DetectorId id : detectors) {
            map.put(id, create(id, scoring));
        }
        return new NormalizerRegistry(map);
    }

    public static NormalizerRegistry fromSettings(PipelineSettings settings) {
        return forDetectors(settings.getFusion().nominalWeights().keySet(), settings.getScoring());
    }

    public NormalizerRegistry with(DetectorId detector, ScoreNormalizer normalizer) {
        Map<DetectorId, ScoreNormalizer> map = new LinkedHashMap<>(normalizers);
        map.put(Objects.requireNonNull(detector, "detector must not be null"),
                Objects.requireNonNull(normalizer, "normalizer must not be null"));
        return new NormalizerRegistry(map);
    }

    /**
     * @param detector detector the raw score came from
     * @param raw      finite raw statistic
     * @param baseline location history
     * @return normalized score in [0,1]
     * @throws IllegalArgumentException if no normalizer is registered
     * @throws ScoreContractViolation   if the normalizer leaves [0,1]
     */
    public double normalize(DetectorId detector, double raw, LocationBaseline baseline) {
        ScoreNormalizer normalizer = normalizers.get(detector);
        if (normalizer == null) {
            throw new IllegalArgumentException("No normalizer registered for detector '" + detector + "'");
        }
        double normalized = normalizer.normalize(raw, baseline);
        if (Double.isNaN(normalized) || normalized < 0.0 || normalized > 1.0) {
            throw new ScoreContractViolation("Normalizer for " + detector + " mapped raw=" + raw
                    + " to " + normalized + ", outside [0,1]");
        }
        return normalized;
    }

    public boolean supports(DetectorId detector) {
        return normalizers.containsKey(detector);
    }
}
