package com.outbreaksentinel.core.scoring;

import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.MetricCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.hospitalOnly;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExternalModelScorer}.
 */
class ExternalModelScorerTest {

    private final ExternalModelScorer scorer = new ExternalModelScorer(DetectorId.ISOLATION_FOREST);
    private final LocationBaseline baseline = LocationBaseline.empty("district-1", TODAY);

    @Test
    @DisplayName("Should pass the attached model output through")
    void passesOutputThrough() {
        MetricCell cell = hospitalOnly("district-1", TODAY, 12).toBuilder()
                .modelOutput("isolation_forest", 0.82)
                .build();

        RawScore raw = scorer.score(cell, baseline);

        assertThat(raw.isValid()).isTrue();
        assertThat(raw.getRaw()).isEqualTo(0.82);
    }

    @Test
    @DisplayName("Should be invalid when the model produced no output")
    void invalidWithoutOutput() {
        RawScore raw = scorer.score(hospitalOnly("district-1", TODAY, 12), baseline);

        assertThat(raw.isValid()).isFalse();
        assertThat(raw.getReason()).contains("no isolation_forest output");
    }

    @Test
    @DisplayName("Should be invalid for a non-finite output")
    void invalidForNonFiniteOutput() {
        MetricCell cell = hospitalOnly("district-1", TODAY, 12).toBuilder()
                .modelOutput("isolation_forest", Double.NaN)
                .build();

        RawScore raw = scorer.score(cell, baseline);

        assertThat(raw.isValid()).isFalse();
        assertThat(raw.getReason()).contains("non-finite");
    }
}
