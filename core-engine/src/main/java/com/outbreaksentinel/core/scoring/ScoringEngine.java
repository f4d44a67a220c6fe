package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.DetectorScore;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.ScoreContractViolation;
import com.outbreaksentinel.core.model.ScoreVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every registered scorer on a cell, normalizes the valid raw scores and
 * assembles the {@link ScoreVector}.
 *
 * <h3>Error handling</h3>
 * <ul>
 * <li>A scorer that throws is recorded as invalid for that detector; the
 * other detectors still score.</li>
 * <li>A normalizer that leaves [0,1] raises {@link ScoreContractViolation},
 * which is fatal to the cell.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ScoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringEngine.class);

    private final ScorerRegistry scorers;
    private final NormalizerRegistry normalizers;
    private final SourceSignalScorer signalScorer;

    public ScoringEngine(ScorerRegistry scorers, NormalizerRegistry normalizers, SourceSignalScorer signalScorer) {
        this.scorers = Objects.requireNonNull(scorers, "ScorerRegistry must not be null");
        this.normalizers = Objects.requireNonNull(normalizers, "NormalizerRegistry must not be null");
        this.signalScorer = Objects.requireNonNull(signalScorer, "SourceSignalScorer must not be null");
        for (DetectorId id : scorers.detectors()) {
            if (!normalizers.supports(id)) {
                throw new IllegalArgumentException("Detector '" + id + "' has a scorer but no normalizer");
            }
        }
    }

    public static ScoringEngine fromSettings(PipelineSettings settings) {
        return new ScoringEngine(
                ScorerRegistry.fromSettings(settings),
                NormalizerRegistry.fromSettings(settings),
                new SourceSignalScorer(settings.getScoring().getZscoreMinHistory()));
    }

    /**
     * @param cell     the cell to score
     * @param baseline the location's history at run start
     * @return one score per registered detector plus the category signals
     * @throws ScoreContractViolation if a normalizer output is out of range
     */
    public ScoreVector score(MetricCell cell, LocationBaseline baseline) {
        Objects.requireNonNull(cell, "MetricCell must not be null");
        Objects.requireNonNull(baseline, "LocationBaseline must not be null");

        List<DetectorScore> scores = new ArrayList<>(scorers.size());
        for (DetectorScorer scorer : scorers.scorers()) {
            DetectorId id = scorer.detector();
            RawScore raw;
            try {
                raw = scorer.score(cell, baseline);
            } catch (RuntimeException e) {
                LOG.warn("Scorer [{}] failed on {}: {}", id, cell.getKey(), e.getMessage(), e);
                scores.add(DetectorScore.invalid(id, "scorer failed: " + e.getMessage()));
                continue;
            }

            if (!raw.isValid()) {
                LOG.debug("Scorer [{}] invalid for {}: {}", id, cell.getKey(), raw.getReason());
                scores.add(DetectorScore.invalid(id, raw.getReason()));
                continue;
            }
            double normalized = normalizers.normalize(id, raw.getRaw(), baseline);
            LOG.debug("Scorer [{}] on {}: raw={} normalized={}", id, cell.getKey(), raw.getRaw(), normalized);
            scores.add(DetectorScore.valid(id, raw.getRaw(), normalized));
        }

        return new ScoreVector(cell.getKey(), scores,
                signalScorer.signals(cell, baseline),
                signalScorer.sourcesWithData(cell));
    }

    public ScorerRegistry getScorers() {
        return scorers;
    }
}
