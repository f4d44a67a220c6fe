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
 * Unit tests for {@link CrossSourceVerificationStage}.
 */
class CrossSourceVerificationStageTest {

    private CrossSourceVerificationStage stage;

    @BeforeEach
    void setUp() {
        PipelineSettings settings = new PipelineSettings();
        stage = new CrossSourceVerificationStage(settings.getVerification(),
                settings.getFusion().requiredSourceCategories());
    }

    @Test
    @DisplayName("Should pass when two categories corroborate")
    void passesWithTwoCorroboratingCategories() {
        MetricCell cell = cell("district-1", TODAY, 30, 40);

        StageOutcome outcome = stage.evaluate(screened(cell, fusion(cell, 0.7, 0.6, 3, 6,
                Map.of(SourceCategory.HOSPITAL, 0.8, SourceCategory.SOCIAL, 0.7))));

        assertThat(outcome.getVerdict().getVerdict()).isEqualTo(Verdict.PASS);
        assertThat(outcome.getNext().getCorroborating())
                .containsExactlyInAnyOrder(SourceCategory.HOSPITAL, SourceCategory.SOCIAL);
    }

    @Test
    @DisplayName("Should pass a single category above the override threshold")
    void passesSingleSourceOverride() {
        MetricCell cell = cell("district-1", TODAY, 30, 40);

        StageOutcome outcome = stage.evaluate(screened(cell, fusion(cell, 0.95, 0.6, 3, 6,
                Map.of(SourceCategory.HOSPITAL, 0.9, SourceCategory.SOCIAL, 0.1))));

        assertThat(outcome.getVerdict().getVerdict()).isEqualTo(Verdict.PASS);
        assertThat(outcome.getVerdict().getRationale()).startsWith("single-source override");
    }

    @Test
    @DisplayName("Should defer a single-source anomaly while a category has yet to report")
    void defersWhileCategoryMissing() {
        MetricCell cell = cell("district-1", TODAY, 30, 40);

        StageOutcome outcome = stage.evaluate(screened(cell, fusion(cell, 0.7, 0.6, 3, 6,
                Map.of(SourceCategory.HOSPITAL, 0.9, SourceCategory.SOCIAL, 0.2))));

        assertThat(outcome.getVerdict().getVerdict()).isEqualTo(Verdict.DEFER);
        assertThat(outcome.getVerdict().getRationale()).contains("awaiting data from environment");
    }

    @Test
    @DisplayName("Should suppress a single-source anomaly when every category has reported")
    void suppressesWhenAllReported() {
        MetricCell cell = withEnvironment(cell("district-1", TODAY, 30, 40), 2.0, 5, 40, 20);

        StageOutcome outcome = stage.evaluate(screened(cell, fusion(cell, 0.7, 0.6, 3, 6,
                Map.of(SourceCategory.HOSPITAL, 0.9, SourceCategory.SOCIAL, 0.2, SourceCategory.ENVIRONMENT, 0.2))));

        assertThat(outcome.getVerdict().getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(outcome.getVerdict().getRationale()).contains("all sources reporting");
    }
}
