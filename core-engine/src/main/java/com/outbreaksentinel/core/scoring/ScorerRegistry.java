package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.DetectorId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The set of detectors a pipeline scores with, in fusion order.
 *
 * <p>
 * {@link #create(DetectorId, PipelineSettings.Scoring)} is the single place
 * that knows the built-in detectors; additional detectors are added with
 * {@link #with(DetectorScorer)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ScorerRegistry.class);

    private final Map<DetectorId, DetectorScorer> scorers;

    private ScorerRegistry(Map<DetectorId, DetectorScorer> scorers) {
        this.scorers = Collections.unmodifiableMap(scorers);
    }

    /**
     * Create the built-in scorer for a detector.
     *
     * @param detector detector identity; must not be {@code null}
     * @param scoring  scoring settings
     * @return a new scorer
     * @throws IllegalArgumentException if the detector is not built in
     */
    public static DetectorScorer create(DetectorId detector, PipelineSettings.Scoring scoring) {
        Objects.requireNonNull(detector, "DetectorId must not be null");
        return switch (detector.name()) {
            case "z_score" -> new ZScoreScorer(scoring.getZscoreMinHistory());
            case "cusum" -> new CusumScorer(scoring.getCusumMinHistory(), scoring.getCusumSlack());
            case "ewma" -> new EwmaScorer(scoring.getEwmaMinHistory(), scoring.getEwmaAlpha());
            case "isolation_forest", "lstm_autoencoder", "prophet_residual" -> new ExternalModelScorer(detector);
            default -> throw new IllegalArgumentException(
                    "No built-in scorer for detector '" + detector + "'. Built-in detectors: "
                            + DetectorId.BUILT_IN);
        };
    }

    /**
     * @param detectors detectors to score with, in order
     * @param scoring   scoring settings
     * @return registry holding a built-in scorer per detector
     */
    public static ScorerRegistry forDetectors(Collection<DetectorId> detectors, PipelineSettings.Scoring scoring) {
        Objects.requireNonNull(detectors, "Detector list must not be null");
        Map<DetectorId, DetectorScorer> map = new LinkedHashMap<>();
        for (DetectorId id : detectors) {
            map.put(id, create(id, scoring));
        }
        LOG.info("Created {} scorer(s): {}", map.size(), map.keySet());
        return new ScorerRegistry(map);
    }

    /**
     * @return registry of every detector named in the fusion weights
     */
    public static ScorerRegistry fromSettings(PipelineSettings settings) {
        return forDetectors(settings.getFusion().nominalWeights().keySet(), settings.getScoring());
    }

    /**
     * @param scorer additional or replacement scorer
     * @return a new registry including {@code scorer}
     */
    public ScorerRegistry with(DetectorScorer scorer) {
        Objects.requireNonNull(scorer, "scorer must not be null");
        Map<DetectorId, DetectorScorer> map = new LinkedHashMap<>(scorers);
        map.put(scorer.detector(), scorer);
        return new ScorerRegistry(map);
    }

    public List<DetectorScorer> scorers() {
        return Collections.unmodifiableList(new ArrayList<>(scorers.values()));
    }

    public Optional<DetectorScorer> get(DetectorId detector) {
        return Optional.ofNullable(scorers.get(detector));
    }

    public Collection<DetectorId> detectors() {
        return scorers.keySet();
    }

    public int size() {
        return scorers.size();
    }
}
