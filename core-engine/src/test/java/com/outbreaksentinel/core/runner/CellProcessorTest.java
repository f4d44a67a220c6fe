package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.alert.AlertStore;
import com.outbreaksentinel.core.alert.AlertStoreException;
import com.outbreaksentinel.core.baseline.BaselineSnapshot;
import com.outbreaksentinel.core.baseline.BaselineStore;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.validation.Verdict;
import com.outbreaksentinel.core.validation.StageVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.outbreaksentinel.core.runner.RunnerFixture.CLOCK;
import static com.outbreaksentinel.core.runner.RunnerFixture.corroboratedSpike;
import static com.outbreaksentinel.core.runner.RunnerFixture.hospitalSpike;
import static com.outbreaksentinel.core.runner.RunnerFixture.quietDay;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CellProcessor}.
 */
class CellProcessorTest {

    private static RunContext context(RunnerFixture fixture, String runId, MetricCell cell) {
        BaselineSnapshot snapshot = new BaselineStore(fixture.cells, fixture.settings.getScoring().getLookbackDays())
                .snapshot(List.of(cell), CLOCK.instant());
        return new RunContext(runId, CLOCK.instant(), snapshot);
    }

    @Test
    @DisplayName("Should escalate, persist and notify a corroborated spike")
    void escalatesCorroboratedSpike() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        MetricCell cell = corroboratedSpike("district-7");

        CellOutcome outcome = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-1", cell));

        assertThat(outcome.getKind()).isEqualTo(CellOutcome.Kind.ESCALATED);
        assertThat(outcome.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(outcome.getMaterialization()).isEqualTo("created");
        assertThat(outcome.isNotified()).isTrue();
        assertThat(outcome.getVerdicts()).extracting(StageVerdict::getVerdict).containsOnly(Verdict.PASS);

        List<Alert> alerts = fixture.lifecycle.alertsForLocation("district-7");
        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.getAlertId()).isEqualTo(outcome.getAlertId());
            assertThat(a.isNotified()).isTrue();
            assertThat(a.getRecommendedActions()).isNotEmpty();
            assertThat(a.getEvidence()).containsKeys("hospital", "social", "environment", "model_scores");
        });
    }

    @Test
    @DisplayName("Should not duplicate the alert when the same cell is processed again")
    void duplicateRunKeepsOneAlert() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        MetricCell cell = corroboratedSpike("district-7");
        CellOutcome first = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-1", cell));

        CellOutcome second = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-2", cell));

        assertThat(second.getKind()).isEqualTo(CellOutcome.Kind.ESCALATED);
        assertThat(second.getMaterialization()).isEqualTo("unchanged");
        assertThat(second.getAlertId()).isEqualTo(first.getAlertId());
        assertThat(fixture.lifecycle.alertsForLocation("district-7")).hasSize(1);
    }

    @Test
    @DisplayName("Should screen out a quiet day without opening a case")
    void screensOutQuietDay() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        MetricCell cell = quietDay("district-7");

        CellOutcome outcome = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-1", cell));

        assertThat(outcome.getKind()).isEqualTo(CellOutcome.Kind.SCREENED_OUT);
        assertThat(outcome.getVerdicts()).isEmpty();
        assertThat(outcome.getRationale()).contains("below screening threshold 0.50");
    }

    @Test
    @DisplayName("Should defer an uncorroborated spike while a required source is missing")
    void defersUncorroboratedSpike() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-5");
        MetricCell cell = hospitalSpike("district-5");

        CellOutcome outcome = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-1", cell));

        assertThat(outcome.getKind()).isEqualTo(CellOutcome.Kind.DEFERRED);
        assertThat(outcome.getRationale()).contains("awaiting data from environment");
        assertThat(fixture.lifecycle.alertsForLocation("district-5")).isEmpty();
    }

    @Test
    @DisplayName("Should report a persistence failure as retryable instead of throwing")
    void persistenceFailureIsRetryable() {
        RunnerFixture fixture = new RunnerFixture(new UnavailableStore()).withHistory("district-7");
        MetricCell cell = corroboratedSpike("district-7");

        CellOutcome outcome = fixture.processor.process(CellTask.fresh(cell), context(fixture, "run-1", cell));

        assertThat(outcome.getKind()).isEqualTo(CellOutcome.Kind.FAILED);
        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.getError()).contains("after 3 attempt(s)");
    }

    /** Every call fails transiently. */
    static final class UnavailableStore implements AlertStore {

        @Override
        public Optional<Alert> findById(String alertId) {
            throw new AlertStoreException("store unavailable", true);
        }

        @Override
        public List<Alert> findByLocation(String location) {
            throw new AlertStoreException("store unavailable", true);
        }

        @Override
        public boolean insert(Alert alert) {
            throw new AlertStoreException("store unavailable", true);
        }

        @Override
        public boolean replace(Alert alert, long expectedVersion) {
            throw new AlertStoreException("store unavailable", true);
        }
    }
}
