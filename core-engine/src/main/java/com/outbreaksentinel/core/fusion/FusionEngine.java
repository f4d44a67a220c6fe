package com.outbreaksentinel.core.fusion;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.DetectorScore;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.ScoreContractViolation;
import com.outbreaksentinel.core.model.ScoreVector;
import com.outbreaksentinel.core.model.SourceCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Combines a {@link ScoreVector} into one composite anomaly score and a
 * coverage-bounded confidence.
 *
 * <h3>Weights</h3>
 * <p>
 * Each detector starts from its nominal weight. Invalid detectors get weight
 * zero and their share is redistributed proportionally over the valid ones,
 * so the weights actually used always sum to 1 over the valid detectors. If
 * every valid detector has nominal weight zero, they share equally.
 * </p>
 *
 * <h3>Confidence</h3>
 * <pre>
 * confidence = (valid detectors / total detectors)
 *            × (required categories with data / required categories)
 * </pre>
 * <p>
 * A high composite from one source category therefore never carries high
 * confidence on its own.
 * </p>
 *
 * <h3>No valid detectors</h3>
 * <p>
 * Composite and confidence are both 0 and the result is not
 * {@linkplain FusionResult#isFusable() fusable}.
 * </p>
 *
 * @since 1.0.0
 */
public class FusionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FusionEngine.class);

    /** Maximum allowed drift of the redistributed weight sum from 1. */
    public static final double WEIGHT_TOLERANCE = 1e-9;

    private final Map<DetectorId, Double> nominalWeights;
    private final Set<SourceCategory> requiredCategories;

    /**
     * @param nominalWeights     non-negative weight per detector
     * @param requiredCategories categories confidence is measured against;
     *                           must not be empty
     */
    public FusionEngine(Map<DetectorId, Double> nominalWeights, Collection<SourceCategory> requiredCategories) {
        Objects.requireNonNull(nominalWeights, "nominalWeights must not be null");
        Objects.requireNonNull(requiredCategories, "requiredCategories must not be null");
        if (requiredCategories.isEmpty()) {
            throw new IllegalArgumentException("requiredCategories must not be empty");
        }
        nominalWeights.forEach((id, w) -> {
            if (w == null || w.isNaN() || w < 0.0) {
                throw new IllegalArgumentException("Nominal weight for " + id + " must be >= 0, got: " + w);
            }
        });
        this.nominalWeights = Collections.unmodifiableMap(new LinkedHashMap<>(nominalWeights));
        this.requiredCategories = Collections.unmodifiableSet(EnumSet.copyOf(requiredCategories));
    }

    public static FusionEngine fromSettings(PipelineSettings settings) {
        return new FusionEngine(settings.getFusion().nominalWeights(),
                settings.getFusion().requiredSourceCategories());
    }

    /**
     * @param scores one cell's scores
     * @return the fused result
     * @throws IllegalArgumentException if a scored detector has no nominal weight
     * @throws ScoreContractViolation   if the redistributed weights drift from 1
     */
    public FusionResult fuse(ScoreVector scores) {
        Objects.requireNonNull(scores, "ScoreVector must not be null");

        Map<DetectorId, Double> weights = redistribute(scores);
        Map<DetectorId, Double> normalized = new LinkedHashMap<>();
        double composite = 0.0;
        int valid = 0;
        for (DetectorScore score : scores.getScores().values()) {
            if (score.isValid()) {
                valid++;
                normalized.put(score.getDetector(), score.getNormalized());
                composite += weights.get(score.getDetector()) * score.getNormalized();
            }
        }

        int total = scores.totalCount();
        double confidence;
        if (valid == 0) {
            composite = 0.0;
            confidence = 0.0;
        } else {
            // Rounding may push a weighted sum of values <= 1 a few ulps above 1.
            composite = Math.min(1.0, composite);
            confidence = ((double) valid / total) * coverage(scores.getSourcesWithData());
        }

        FusionResult result = new FusionResult(scores.getCellKey(), composite, confidence, weights,
                normalized, scores.getSourceSignals(), scores.getSourcesWithData(), valid, total,
                scores.contentHash());
        LOG.debug("Fused {}: composite={} confidence={} valid={}/{}",
                scores.getCellKey(), composite, confidence, valid, total);
        return result;
    }

    /**
     * @return the weight used per scored detector; zero for invalid detectors
     */
    Map<DetectorId, Double> redistribute(ScoreVector scores) {
        double validNominalSum = 0.0;
        int validCount = 0;
        for (DetectorScore score : scores.getScores().values()) {
            Double nominal = nominalWeights.get(score.getDetector());
            if (nominal == null) {
                throw new IllegalArgumentException("No nominal weight for detector '" + score.getDetector() + "'");
            }
            if (score.isValid()) {
                validNominalSum += nominal;
                validCount++;
            }
        }

        Map<DetectorId, Double> weights = new LinkedHashMap<>();
        double sum = 0.0;
        for (DetectorScore score : scores.getScores().values()) {
            double w;
            if (!score.isValid()) {
                w = 0.0;
            } else if (validNominalSum > 0.0) {
                w = nominalWeights.get(score.getDetector()) / validNominalSum;
            } else {
                w = 1.0 / validCount;
            }
            weights.put(score.getDetector(), w);
            sum += w;
        }

        if (validCount > 0 && Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ScoreContractViolation("Redistributed weights for " + scores.getCellKey()
                    + " sum to " + sum + ", expected 1 ± " + WEIGHT_TOLERANCE);
        }
        return weights;
    }

    private double coverage(Set<SourceCategory> withData) {
        long covered = requiredCategories.stream().filter(withData::contains).count();
        return (double) covered / requiredCategories.size();
    }

    public Map<DetectorId, Double> getNominalWeights() {
        return nominalWeights;
    }

    public Set<SourceCategory> getRequiredCategories() {
        return requiredCategories;
    }
}
