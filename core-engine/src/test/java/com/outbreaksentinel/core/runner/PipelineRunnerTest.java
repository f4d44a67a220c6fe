package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.baseline.BaselineStore;
import com.outbreaksentinel.core.baseline.CellSource;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.AlertStatus;
import com.outbreaksentinel.core.model.MetricCell;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.runner.RunnerFixture.CLOCK;
import static com.outbreaksentinel.core.runner.RunnerFixture.corroboratedSpike;
import static com.outbreaksentinel.core.runner.RunnerFixture.hospitalSpike;
import static com.outbreaksentinel.core.runner.RunnerFixture.quietDay;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineRunner}.
 */
class PipelineRunnerTest {

    private LocalRunExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    @TempDir
    Path dir;

    /** Cursor starts the day before {@code TODAY}, so only today's cells are pending. */
    private PipelineRunner runner(RunnerFixture fixture) {
        return runner(fixture, CLOCK, new InMemoryRunStateStore());
    }

    private PipelineRunner runner(RunnerFixture fixture, Clock clock, RunStateStore state) {
        if (executor == null) {
            executor = new LocalRunExecutor(fixture.processor, 2);
        }
        return new PipelineRunner(fixture.cells,
                new BaselineStore(fixture.cells, fixture.settings.getScoring().getLookbackDays()),
                executor, new DeferralRegistry(), new AuditTrail(), clock, 0, state);
    }

    @Test
    @DisplayName("Should process every pending cell and advance the cursor")
    void processesPendingCells() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7").withHistory("district-8");
        fixture.cells.save(corroboratedSpike("district-7"));
        fixture.cells.save(quietDay("district-8"));
        PipelineRunner runner = runner(fixture);

        RunReport report = runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(report.getTrigger()).isEqualTo("scheduled");
        assertThat(report.getCellsPending()).isEqualTo(2);
        assertThat(report.getEscalated()).isEqualTo(1);
        assertThat(report.getScreenedOut()).isEqualTo(1);
        assertThat(report.getAlertsCreated()).isEqualTo(1);
        assertThat(report.getCursorBefore()).isEqualTo(TODAY.minusDays(1));
        assertThat(report.getCursorAfter()).isEqualTo(TODAY);
        assertThat(runner.getCursor()).contains(TODAY);
        assertThat(runner.lastRun()).contains(report);
        assertThat(runner.currentRun()).isEmpty();
    }

    @Test
    @DisplayName("Should find nothing new on a second run and keep a single alert")
    void secondRunIsIdle() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        fixture.cells.save(corroboratedSpike("district-7"));
        PipelineRunner runner = runner(fixture);
        runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        RunReport second = runner.run(PipelineRunner.TRIGGER_MANUAL);

        assertThat(second.getCellsPending()).isZero();
        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(fixture.lifecycle.alertsForLocation("district-7")).hasSize(1);
        assertThat(runner.history()).hasSize(2);
        assertThat(second.getRunId()).isNotEqualTo(runner.history().get(1).getRunId());
    }

    @Test
    @DisplayName("Should process a cell again once it is re-aggregated with more data")
    void reaggregatedCellIsReprocessed() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        fixture.cells.save(quietDay("district-7"));
        PipelineRunner runner = runner(fixture);
        RunReport quiet = runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        fixture.cells.save(corroboratedSpike("district-7"));
        RunReport updated = runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        assertThat(quiet.getScreenedOut()).isEqualTo(1);
        assertThat(updated.getCellsPending()).isEqualTo(1);
        assertThat(updated.getAlertsCreated()).isEqualTo(1);
        assertThat(fixture.lifecycle.alertsForLocation("district-7")).hasSize(1);
    }

    @Test
    @DisplayName("Should resume from saved state after a restart without replaying processed cells")
    void restartResumesFromSavedState() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7").withHistory("district-5");
        fixture.cells.save(corroboratedSpike("district-7"));
        MetricCell deferred = hospitalSpike("district-5");
        fixture.cells.save(deferred);
        JsonFileRunStateStore state = new JsonFileRunStateStore(dir.resolve("run-state.json"));
        runner(fixture, CLOCK, state).run(PipelineRunner.TRIGGER_SCHEDULED);

        PipelineRunner restarted = runner(fixture, Clock.offset(CLOCK, Duration.ofMinutes(10)),
                new JsonFileRunStateStore(dir.resolve("run-state.json")));

        assertThat(restarted.getCursor()).contains(TODAY);
        assertThat(restarted.getDeferrals().deferralsOf(deferred.getKey())).isEqualTo(1);

        RunReport report = restarted.run(PipelineRunner.TRIGGER_SCHEDULED);

        assertThat(report.getCellsPending()).isEqualTo(1);
        assertThat(report.getDeferred()).isEqualTo(1);
        assertThat(restarted.getDeferrals().deferralsOf(deferred.getKey())).isEqualTo(2);
        assertThat(fixture.lifecycle.alertsForLocation("district-7")).hasSize(1);
    }

    @Test
    @DisplayName("Should not raise a new alert when a fresh runner replays cells behind a resolved alert")
    void replayAfterResolutionRaisesNothing() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        fixture.cells.save(corroboratedSpike("district-7"));
        runner(fixture).run(PipelineRunner.TRIGGER_SCHEDULED);
        String alertId = fixture.lifecycle.alertsForLocation("district-7").get(0).getAlertId();
        fixture.lifecycle.transition(alertId, AlertStatus.ACKNOWLEDGED);
        fixture.lifecycle.transition(alertId, AlertStatus.RESOLVED);

        RunReport replay = runner(fixture, Clock.offset(CLOCK, Duration.ofMinutes(10)), new InMemoryRunStateStore())
                .run(PipelineRunner.TRIGGER_MANUAL);

        assertThat(replay.getCellsPending()).isEqualTo(1);
        assertThat(replay.getAlertsCreated()).isZero();
        assertThat(fixture.lifecycle.alertsForLocation("district-7")).hasSize(1);
    }

    @Test
    @DisplayName("Should re-evaluate a deferred cell on later runs until the deferral limit")
    void deferralsAreRevisited() {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-5");
        MetricCell spike = hospitalSpike("district-5");
        fixture.cells.save(spike);
        PipelineRunner runner = runner(fixture);
        int maxCycles = fixture.settings.getDeferral().getMaxCycles();

        for (int i = 1; i <= maxCycles; i++) {
            RunReport report = runner.run(PipelineRunner.TRIGGER_SCHEDULED);
            assertThat(report.getDeferred()).isEqualTo(1);
            assertThat(runner.getDeferrals().deferralsOf(spike.getKey())).isEqualTo(i);
        }

        RunReport last = runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        assertThat(last.getSuppressed()).isEqualTo(1);
        assertThat(runner.getDeferrals().size()).isZero();
        List<AuditTrail.Entry> audited = runner.getAudit().forCell(spike.getKey());
        assertThat(audited).hasSize(maxCycles + 1);
        assertThat(audited.get(maxCycles).getOutcome().getRationale())
                .startsWith("deferred " + maxCycles + " time(s), limit " + maxCycles + " reached");
    }

    @Test
    @DisplayName("Should hold the cursor back and retry a cell whose alert could not be persisted")
    void retryableFailureHoldsCursor() {
        RunnerFixture failing = new RunnerFixture(new CellProcessorTest.UnavailableStore()).withHistory("district-7");
        failing.cells.save(corroboratedSpike("district-7"));
        PipelineRunner runner = runner(failing);

        RunReport first = runner.run(PipelineRunner.TRIGGER_SCHEDULED);
        RunReport second = runner.run(PipelineRunner.TRIGGER_SCHEDULED);

        assertThat(first.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(first.getFailed()).isEqualTo(1);
        assertThat(first.getError()).contains("will be retried");
        assertThat(first.getCursorAfter()).isEqualTo(TODAY.minusDays(1));
        assertThat(second.getCellsPending()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the cursor behind the earliest retryable failure")
    void advanceCursorStopsBeforeRetryable() {
        LocalDate before = TODAY.minusDays(3);
        MetricCell older = quietDay("district-1").toBuilder().timeBucket(TODAY.minusDays(2)).build();
        MetricCell newer = quietDay("district-2");
        List<CellTask> tasks = List.of(CellTask.fresh(older), CellTask.fresh(newer));
        CellOutcome failed = CellOutcome.builder(older.getKey(), CellOutcome.Kind.FAILED)
                .failure("store down", true)
                .build();
        CellOutcome fine = CellOutcome.builder(newer.getKey(), CellOutcome.Kind.SCREENED_OUT).build();

        assertThat(PipelineRunner.advanceCursor(before, tasks, List.of(failed, fine)))
                .isEqualTo(TODAY.minusDays(3));
        assertThat(PipelineRunner.advanceCursor(before, tasks, List.of(fine)))
                .isEqualTo(TODAY);
    }

    @Test
    @DisplayName("Should report a failed run when the cell source cannot be read")
    void sourceFailure() {
        RunnerFixture fixture = new RunnerFixture();
        executor = new LocalRunExecutor(fixture.processor, 1);
        PipelineRunner runner = new PipelineRunner(new BrokenSource(),
                new BaselineStore(fixture.cells, 14), executor, new DeferralRegistry(), new AuditTrail(), CLOCK, 0);

        RunReport report = runner.run(PipelineRunner.TRIGGER_MANUAL);

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.getError()).isEqualTo("cell directory unreadable");
        assertThat(runner.getCursor()).isEmpty();
    }

    @Test
    @DisplayName("Should run on demand through the scheduler")
    void schedulerRunNow() throws Exception {
        RunnerFixture fixture = new RunnerFixture().withHistory("district-7");
        fixture.cells.save(corroboratedSpike("district-7"));
        try (PipelineScheduler scheduler = new PipelineScheduler(runner(fixture), Duration.ofHours(1))) {
            RunReport report = scheduler.runNow().get(10, TimeUnit.SECONDS);

            assertThat(report.getTrigger()).isEqualTo(PipelineRunner.TRIGGER_MANUAL);
            assertThat(report.getEscalated()).isEqualTo(1);
        }
    }

    private static final class BrokenSource implements CellSource {

        @Override
        public List<MetricCell> findAfter(LocalDate cursor) {
            throw new IllegalStateException("cell directory unreadable");
        }

        @Override
        public List<MetricCell> findRange(String location, LocalDate fromInclusive, LocalDate toExclusive) {
            return List.of();
        }

        @Override
        public Optional<MetricCell> find(CellKey key) {
            return Optional.empty();
        }
    }
}
