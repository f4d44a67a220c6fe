package com.outbreaksentinel.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * All detector scores for one {@link MetricCell}, plus the per-category
 * anomaly signals used for cross-source corroboration.
 *
 * <p>
 * {@code sourceSignals} holds, for every category that had enough data, a
 * normalized [0, 1] signal for that category alone. A category missing from
 * the map could not be judged.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoreVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CellKey cellKey;
    private final Map<DetectorId, DetectorScore> scores;
    private final Map<SourceCategory, Double> sourceSignals;
    private final Set<SourceCategory> sourcesWithData;

    public ScoreVector(CellKey cellKey,
            Collection<DetectorScore> scores,
            Map<SourceCategory, Double> sourceSignals,
            Set<SourceCategory> sourcesWithData) {
        this.cellKey = Objects.requireNonNull(cellKey, "cellKey must not be null");
        Objects.requireNonNull(scores, "scores must not be null");

        Map<DetectorId, DetectorScore> byDetector = new LinkedHashMap<>();
        for (DetectorScore score : scores) {
            if (byDetector.put(score.getDetector(), score) != null) {
                throw new IllegalArgumentException("Duplicate score for detector " + score.getDetector());
            }
        }
        this.scores = Collections.unmodifiableMap(byDetector);

        Map<SourceCategory, Double> signals = new EnumMap<>(SourceCategory.class);
        if (sourceSignals != null) {
            sourceSignals.forEach((category, signal) -> {
                if (signal == null || signal.isNaN() || signal < 0.0 || signal > 1.0) {
                    throw new ScoreContractViolation("Source signal for " + category.key()
                            + " must be in [0,1], got: " + signal);
                }
                signals.put(category, signal);
            });
        }
        this.sourceSignals = Collections.unmodifiableMap(signals);
        this.sourcesWithData = sourcesWithData == null || sourcesWithData.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(SourceCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(sourcesWithData));
    }

    public CellKey getCellKey() {
        return cellKey;
    }

    public Map<DetectorId, DetectorScore> getScores() {
        return scores;
    }

    public Optional<DetectorScore> score(DetectorId detector) {
        return Optional.ofNullable(scores.get(detector));
    }

    public Map<SourceCategory, Double> getSourceSignals() {
        return sourceSignals;
    }

    public Set<SourceCategory> getSourcesWithData() {
        return sourcesWithData;
    }

    public int validCount() {
        return (int) scores.values().stream().filter(DetectorScore::isValid).count();
    }

    public int totalCount() {
        return scores.size();
    }

    /**
     * Stable digest of everything fusion depends on. Two vectors with equal
     * content hash always fuse to the same result.
     *
     * @return hex digest
     */
    public String contentHash() {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(scores).forEach((id, s) -> sb.append(id).append('=')
                .append(s.isValid() ? s.getNormalized() : "x").append(';'));
        sourceSignals.forEach((c, v) -> sb.append(c.key()).append('=').append(v).append(';'));
        sourcesWithData.forEach(c -> sb.append('+').append(c.key()));
        return ContentHash.sha256(sb.toString());
    }

    @Override
    public String toString() {
        return "ScoreVector{" +
                "cell=" + cellKey +
                ", scores=" + scores.values() +
                ", sourceSignals=" + sourceSignals +
                '}';
    }
}
