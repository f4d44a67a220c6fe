package com.outbreaksentinel.core.fusion;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.DetectorScore;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.ScoreVector;
import com.outbreaksentinel.core.model.SourceCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FusionEngine}.
 */
class FusionEngineTest {

    private static final CellKey KEY = new CellKey("district-2", TODAY);
    private static final Set<SourceCategory> ALL = EnumSet.allOf(SourceCategory.class);

    private FusionEngine engine;

    @BeforeEach
    void setUp() {
        engine = FusionEngine.fromSettings(new PipelineSettings());
    }

    private static ScoreVector vector(List<DetectorScore> scores, Set<SourceCategory> withData) {
        return new ScoreVector(KEY, scores, Map.of(), withData);
    }

    private static List<DetectorScore> allValid(double normalized) {
        List<DetectorScore> scores = new ArrayList<>();
        for (DetectorId id : DetectorId.BUILT_IN) {
            scores.add(DetectorScore.valid(id, normalized, normalized));
        }
        return scores;
    }

    @Test
    @DisplayName("Should use nominal weights when every detector is valid")
    void nominalWeightsWhenAllValid() {
        FusionResult result = engine.fuse(vector(allValid(0.6), ALL));

        assertThat(result.getCompositeScore()).isCloseTo(0.6, within(1e-9));
        assertThat(result.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getWeights().get(DetectorId.LSTM_AUTOENCODER)).isCloseTo(0.25, within(1e-12));
        assertThat(result.getValidDetectors()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should redistribute weight from invalid detectors proportionally")
    void redistributesInvalidWeight() {
        List<DetectorScore> scores = List.of(
                DetectorScore.valid(DetectorId.Z_SCORE, 4.0, 0.8),
                DetectorScore.valid(DetectorId.CUSUM, 3.0, 0.6),
                DetectorScore.valid(DetectorId.EWMA, 2.0, 0.4),
                DetectorScore.invalid(DetectorId.LSTM_AUTOENCODER, "no output"),
                DetectorScore.invalid(DetectorId.ISOLATION_FOREST, "no output"),
                DetectorScore.invalid(DetectorId.PROPHET_RESIDUAL, "no output"));

        FusionResult result = engine.fuse(vector(scores, ALL));

        // nominal 0.15 / 0.15 / 0.10 over a valid sum of 0.40
        assertThat(result.getWeights().get(DetectorId.Z_SCORE)).isCloseTo(0.375, within(1e-12));
        assertThat(result.getWeights().get(DetectorId.EWMA)).isCloseTo(0.25, within(1e-12));
        assertThat(result.getWeights().get(DetectorId.LSTM_AUTOENCODER)).isZero();
        assertThat(result.getCompositeScore()).isCloseTo(0.375 * 0.8 + 0.375 * 0.6 + 0.25 * 0.4, within(1e-12));
        assertThat(result.getConfidence()).isCloseTo(0.5, within(1e-12));
        assertThat(result.getNormalizedScores()).containsOnlyKeys(DetectorId.Z_SCORE, DetectorId.CUSUM, DetectorId.EWMA);
    }

    @Test
    @DisplayName("Should scale confidence by source coverage")
    void confidenceScalesWithCoverage() {
        FusionResult result = engine.fuse(vector(allValid(0.5),
                EnumSet.of(SourceCategory.HOSPITAL, SourceCategory.SOCIAL)));

        assertThat(result.getConfidence()).isCloseTo(2.0 / 3.0, within(1e-12));
    }

    @Test
    @DisplayName("Should fall back to equal weights when every valid detector has zero nominal weight")
    void equalWeightsForZeroNominal() {
        Map<DetectorId, Double> weights = new LinkedHashMap<>();
        weights.put(DetectorId.Z_SCORE, 0.0);
        weights.put(DetectorId.CUSUM, 0.0);
        weights.put(DetectorId.EWMA, 1.0);
        FusionEngine zeroed = new FusionEngine(weights, ALL);
        List<DetectorScore> scores = List.of(
                DetectorScore.valid(DetectorId.Z_SCORE, 1.0, 0.2),
                DetectorScore.valid(DetectorId.CUSUM, 1.0, 0.4),
                DetectorScore.invalid(DetectorId.EWMA, "insufficient history"));

        FusionResult result = zeroed.fuse(vector(scores, ALL));

        assertThat(result.getWeights().get(DetectorId.Z_SCORE)).isCloseTo(0.5, within(1e-12));
        assertThat(result.getCompositeScore()).isCloseTo(0.3, within(1e-12));
    }

    @Test
    @DisplayName("Should report zero composite and confidence when nothing is valid")
    void zeroWhenNothingValid() {
        List<DetectorScore> scores = List.of(
                DetectorScore.invalid(DetectorId.Z_SCORE, "insufficient history"),
                DetectorScore.invalid(DetectorId.CUSUM, "insufficient history"));

        FusionResult result = engine.fuse(vector(scores, ALL));

        assertThat(result.getCompositeScore()).isZero();
        assertThat(result.getConfidence()).isZero();
        assertThat(result.isFusable()).isFalse();
        assertThat(result.getWeights().values()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Should throw for a detector without a nominal weight")
    void rejectsUnknownDetector() {
        List<DetectorScore> scores = List.of(DetectorScore.valid(DetectorId.of("seasonal"), 1.0, 0.5));

        assertThatThrownBy(() -> engine.fuse(vector(scores, ALL)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seasonal");
    }

    @Test
    @DisplayName("Should reject negative nominal weights and empty coverage")
    void rejectsBadConfiguration() {
        assertThatThrownBy(() -> new FusionEngine(Map.of(DetectorId.Z_SCORE, -0.1), ALL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FusionEngine(Map.of(DetectorId.Z_SCORE, 1.0), Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep weights summing to one and the composite inside [0,1] for any validity mix")
    void invariantsHoldForRandomInputs() {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            List<DetectorScore> scores = new ArrayList<>();
            for (DetectorId id : DetectorId.BUILT_IN) {
                if (random.nextBoolean()) {
                    double n = random.nextDouble();
                    scores.add(DetectorScore.valid(id, n, n));
                } else {
                    scores.add(DetectorScore.invalid(id, "random"));
                }
            }

            FusionResult result = engine.fuse(vector(scores, ALL));

            assertThat(result.getCompositeScore()).isBetween(0.0, 1.0);
            assertThat(result.getConfidence()).isBetween(0.0, 1.0);
            if (result.getValidDetectors() > 0) {
                double sum = result.getWeights().values().stream().mapToDouble(Double::doubleValue).sum();
                assertThat(sum).isCloseTo(1.0, within(FusionEngine.WEIGHT_TOLERANCE));
            }
        }
    }

    @Test
    @DisplayName("Should derive the same result id from the same inputs")
    void stableResultId() {
        FusionResult first = engine.fuse(vector(allValid(0.7), ALL));
        FusionResult second = engine.fuse(vector(allValid(0.7), ALL));
        FusionResult other = engine.fuse(vector(allValid(0.71), ALL));

        assertThat(first.getResultId()).isEqualTo(second.getResultId());
        assertThat(first.getResultId()).isNotEqualTo(other.getResultId());
    }
}
