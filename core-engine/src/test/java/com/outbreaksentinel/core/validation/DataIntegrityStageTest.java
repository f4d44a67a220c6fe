package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.cell;
import static com.outbreaksentinel.core.TestCells.withEnvironment;
import static com.outbreaksentinel.core.validation.CaseFixtures.fusion;
import static com.outbreaksentinel.core.validation.CaseFixtures.screened;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DataIntegrityStage}.
 */
class DataIntegrityStageTest {

    private DataIntegrityStage stage;

    @BeforeEach
    void setUp() {
        stage = new DataIntegrityStage(new PipelineSettings().getIntegrity());
    }

    private StageVerdict evaluate(MetricCell cell, int validDetectors) {
        return stage.evaluate(screened(cell, fusion(cell, 0.7, 0.6, validDetectors, 6, Map.of()))).getVerdict();
    }

    @Test
    @DisplayName("Should pass a well-formed cell with enough detectors and volume")
    void passesWellFormedCell() {
        StageVerdict verdict = evaluate(cell("district-1", TODAY, 30, 40), 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.PASS);
        assertThat(verdict.getRationale()).contains("3/6 detectors valid");
    }

    @Test
    @DisplayName("Should suppress negative counts")
    void suppressesNegativeCounts() {
        StageVerdict verdict = evaluate(cell("district-1", TODAY, -3, 40), 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(verdict.getRationale()).contains("negative hospital event count");
    }

    @Test
    @DisplayName("Should suppress counts whose source is not flagged")
    void suppressesProvenanceMismatch() {
        MetricCell unflagged = MetricCell.builder()
                .location("district-1")
                .timeBucket(TODAY)
                .hospitalEvents(30)
                .socialMentions(40)
                .source(SourceCategory.SOCIAL)
                .build();

        StageVerdict verdict = evaluate(unflagged, 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(verdict.getRationale()).contains("hospital source not flagged");
    }

    @Test
    @DisplayName("Should suppress an out-of-range vector index")
    void suppressesOutOfRangeEnvironment() {
        StageVerdict verdict = evaluate(withEnvironment(cell("district-1", TODAY, 30, 40), 12.0, 10, 70, 28), 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(verdict.getRationale()).contains("vector index out of range");
    }

    @Test
    @DisplayName("Should suppress an environment flag without a reading")
    void suppressesEnvironmentFlagWithoutReading() {
        MetricCell flagged = cell("district-1", TODAY, 30, 40).toBuilder()
                .source(SourceCategory.ENVIRONMENT)
                .build();

        StageVerdict verdict = evaluate(flagged, 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(verdict.getRationale()).contains("environment source flagged without a reading");
    }

    @Test
    @DisplayName("Should defer when too few detectors produced a score")
    void defersOnTooFewDetectors() {
        StageVerdict verdict = evaluate(cell("district-1", TODAY, 30, 40), 1);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.DEFER);
        assertThat(verdict.getRationale()).isEqualTo("only 1 valid detector(s), need 2");
    }

    @Test
    @DisplayName("Should defer when the sample is too small")
    void defersOnSmallSample() {
        StageVerdict verdict = evaluate(cell("district-1", TODAY, 1, 2), 3);

        assertThat(verdict.getVerdict()).isEqualTo(Verdict.DEFER);
        assertThat(verdict.getRationale()).contains("sample size 3 below minimum 5");
    }
}
