package com.outbreaksentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Composite output of fusion for one {@link MetricCell}.
 *
 * <p>
 * Results are content-addressed: {@link #getResultId()} is derived from the
 * location, the time bucket and the hash of the fused inputs, so re-running
 * fusion on unchanged inputs yields an identical result and updated data
 * yields a new one rather than a mutation.
 * </p>
 *
 * @since 1.0.0
 */
public final class FusionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String resultId;
    private final CellKey cellKey;
    private final double compositeScore;
    private final double confidence;
    private final Map<DetectorId, Double> weights;
    private final Map<DetectorId, Double> normalizedScores;
    private final Map<SourceCategory, Double> sourceSignals;
    private final Set<SourceCategory> sourcesWithData;
    private final int validDetectors;
    private final int totalDetectors;
    private final String inputHash;

    public FusionResult(CellKey cellKey,
            double compositeScore,
            double confidence,
            Map<DetectorId, Double> weights,
            Map<DetectorId, Double> normalizedScores,
            Map<SourceCategory, Double> sourceSignals,
            Set<SourceCategory> sourcesWithData,
            int validDetectors,
            int totalDetectors,
            String inputHash) {
        this.cellKey = Objects.requireNonNull(cellKey, "cellKey must not be null");
        this.inputHash = Objects.requireNonNull(inputHash, "inputHash must not be null");
        if (compositeScore < 0.0 || compositeScore > 1.0 || Double.isNaN(compositeScore)) {
            throw new ScoreContractViolation("compositeScore must be in [0,1], got: " + compositeScore);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new ScoreContractViolation("confidence must be in [0,1], got: " + confidence);
        }
        this.compositeScore = compositeScore;
        this.confidence = confidence;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.normalizedScores = Collections.unmodifiableMap(new LinkedHashMap<>(normalizedScores));
        Map<SourceCategory, Double> signals = new EnumMap<>(SourceCategory.class);
        signals.putAll(sourceSignals);
        this.sourceSignals = Collections.unmodifiableMap(signals);
        this.sourcesWithData = sourcesWithData.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(SourceCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(sourcesWithData));
        this.validDetectors = validDetectors;
        this.totalDetectors = totalDetectors;
        this.resultId = ContentHash.sha256(cellKey.getLocation(), cellKey.getTimeBucket().toString(), inputHash);
    }

    public String getResultId() {
        return resultId;
    }

    public CellKey getCellKey() {
        return cellKey;
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Redistributed weights actually used. Invalid detectors map to zero.
     *
     * @return unmodifiable detector-to-weight map
     */
    public Map<DetectorId, Double> getWeights() {
        return weights;
    }

    /**
     * @return normalized scores of the valid detectors
     */
    public Map<DetectorId, Double> getNormalizedScores() {
        return normalizedScores;
    }

    public Map<SourceCategory, Double> getSourceSignals() {
        return sourceSignals;
    }

    public Set<SourceCategory> getSourcesWithData() {
        return sourcesWithData;
    }

    public int getValidDetectors() {
        return validDetectors;
    }

    public int getTotalDetectors() {
        return totalDetectors;
    }

    public String getInputHash() {
        return inputHash;
    }

    /**
     * A result with zero confidence carries no usable fusion and must never
     * enter validation.
     *
     * @return {@code true} if at least one detector contributed
     */
    public boolean isFusable() {
        return validDetectors > 0 && confidence > 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FusionResult that))
            return false;
        return resultId.equals(that.resultId);
    }

    @Override
    public int hashCode() {
        return resultId.hashCode();
    }

    @Override
    public String toString() {
        return String.format("FusionResult{cell=%s, composite=%.3f, confidence=%.3f, valid=%d/%d}",
                cellKey, compositeScore, confidence, validDetectors, totalDetectors);
    }
}
