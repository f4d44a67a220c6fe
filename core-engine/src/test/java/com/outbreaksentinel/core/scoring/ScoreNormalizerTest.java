package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.ScoreContractViolation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.hospitalOnly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the {@link ScoreNormalizer} implementations and
 * {@link NormalizerRegistry}.
 */
class ScoreNormalizerTest {

    private static final LocationBaseline EMPTY = LocationBaseline.empty("district-1", TODAY);

    private static final double[] RAW_VALUES = {
            Double.NEGATIVE_INFINITY, -100, -1, 0, 0.25, 0.5, 0.75, 1, 2, 3, 4.5, 10, 1e6, Double.POSITIVE_INFINITY };

    @Test
    @DisplayName("Should keep every built-in normalizer monotonic and inside [0,1]")
    void builtInsAreMonotonicAndBounded() {
        PipelineSettings.Scoring scoring = new PipelineSettings().getScoring();

        for (DetectorId id : DetectorId.BUILT_IN) {
            ScoreNormalizer normalizer = NormalizerRegistry.create(id, scoring);
            double previous = -1.0;
            for (double raw : RAW_VALUES) {
                double n = normalizer.normalize(raw, EMPTY);
                assertThat(n).as("%s(%s)", id, raw).isBetween(0.0, 1.0);
                assertThat(n).as("%s monotonic at %s", id, raw).isGreaterThanOrEqualTo(previous);
                previous = n;
            }
        }
    }

    @Test
    @DisplayName("Should map non-positive statistics to zero with the sigmoid")
    void sigmoidZeroForNonPositive() {
        SigmoidNormalizer sigmoid = new SigmoidNormalizer(4.0);

        assertThat(sigmoid.normalize(-2.0, EMPTY)).isZero();
        assertThat(sigmoid.normalize(0.0, EMPTY)).isZero();
        assertThat(sigmoid.normalize(4.0, EMPTY)).isCloseTo(Math.tanh(1.0), within(1e-12));
    }

    @Test
    @DisplayName("Should clip linearly between the bounds")
    void clippedLinear() {
        ClippedLinearNormalizer isolation = new ClippedLinearNormalizer(0.5, 1.0);

        assertThat(isolation.normalize(0.3, EMPTY)).isZero();
        assertThat(isolation.normalize(0.75, EMPTY)).isCloseTo(0.5, within(1e-12));
        assertThat(isolation.normalize(1.2, EMPTY)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an empty or inverted range")
    void clippedLinearRejectsInvertedRange() {
        assertThatThrownBy(() -> new ClippedLinearNormalizer(1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should scale against the location's own output history once enough exists")
    void baselineRangeUsesHistory() {
        List<MetricCell> history = new ArrayList<>();
        double[] outputs = { 0.1, 0.2, 0.1, 0.2, 0.1, 0.2 };
        for (int i = 0; i < outputs.length; i++) {
            history.add(hospitalOnly("district-1", TODAY.minusDays(outputs.length - i), 10).toBuilder()
                    .modelOutput("lstm_autoencoder", outputs[i])
                    .build());
        }
        LocationBaseline baseline = new LocationBaseline("district-1", TODAY, history);
        BaselineRangeNormalizer normalizer = new BaselineRangeNormalizer("lstm_autoencoder", 5, 3.0, 0.0, 1.0);

        // mean 0.15, σ 0.05: the window is [0.15, 0.30]
        assertThat(normalizer.normalize(0.12, baseline)).isZero();
        assertThat(normalizer.normalize(0.225, baseline)).isCloseTo(0.5, within(1e-9));
        assertThat(normalizer.normalize(0.9, baseline)).isEqualTo(1.0);
        // Without history the fallback range applies.
        assertThat(normalizer.normalize(0.9, EMPTY)).isCloseTo(0.9, within(1e-12));
    }

    @Test
    @DisplayName("Should refuse a normalizer that leaves [0,1]")
    void registryEnforcesRange() {
        NormalizerRegistry registry = NormalizerRegistry
                .forDetectors(List.of(DetectorId.Z_SCORE), new PipelineSettings().getScoring())
                .with(DetectorId.Z_SCORE, (raw, baseline) -> raw);

        assertThat(registry.normalize(DetectorId.Z_SCORE, 0.4, EMPTY)).isEqualTo(0.4);
        assertThatThrownBy(() -> registry.normalize(DetectorId.Z_SCORE, 1.5, EMPTY))
                .isInstanceOf(ScoreContractViolation.class)
                .hasMessageContaining("outside [0,1]");
    }

    @Test
    @DisplayName("Should throw for a detector without a normalizer")
    void registryRejectsUnknownDetector() {
        NormalizerRegistry registry = NormalizerRegistry
                .forDetectors(List.of(DetectorId.Z_SCORE), new PipelineSettings().getScoring());

        assertThat(registry.supports(DetectorId.CUSUM)).isFalse();
        assertThatThrownBy(() -> registry.normalize(DetectorId.CUSUM, 1.0, EMPTY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NormalizerRegistry.create(DetectorId.of("seasonal"), new PipelineSettings().getScoring()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seasonal");
    }
}
