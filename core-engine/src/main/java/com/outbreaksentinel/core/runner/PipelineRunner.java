package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.baseline.BaselineSnapshot;
import com.outbreaksentinel.core.baseline.BaselineStore;
import com.outbreaksentinel.core.baseline.CellSource;
import com.outbreaksentinel.core.baseline.MetricCellCodec;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.MetricCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One pass of the pipeline over every pending cell.
 *
 * <h3>Pending cells</h3>
 * <p>
 * A cell is pending when its bucket lies after the scan start and the
 * version now in the source has not been processed yet, judged by its
 * content fingerprint. A cell re-aggregated with more data therefore runs
 * again. The scan starts at the cursor of the last pass, or
 * {@code initialLookbackDays} before today if that is earlier, so the recent
 * window is always re-checked. Every currently deferred cell is pending as
 * well.
 * </p>
 *
 * <h3>Cursor</h3>
 * <p>
 * After a pass the cursor moves to the latest processed bucket, but never
 * past the day before the earliest retryable failure, so a cell whose alert
 * could not be persisted is picked up again. Re-processing the cells in
 * between is harmless because materialization deduplicates.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Cursor, fingerprints and deferral counts are loaded from the
 * {@link RunStateStore} when the runner is built and saved after every pass,
 * so a restart neither replays history nor resets the deferral limit.
 * </p>
 *
 * <p>
 * Passes are serialized: {@link #run(String)} is {@code synchronized}.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineRunner.class);

    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";

    static final int HISTORY_SIZE = 50;

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final CellSource source;
    private final BaselineStore baselines;
    private final RunExecutor executor;
    private final DeferralRegistry deferrals;
    private final AuditTrail audit;
    private final Clock clock;
    private final int initialLookbackDays;
    private final RunStateStore stateStore;
    private final MetricCellCodec codec = new MetricCellCodec();
    private final Map<CellKey, String> fingerprints = new TreeMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Deque<RunReport> history = new ArrayDeque<>();

    private volatile LocalDate cursor;
    private volatile RunReport current;

    public PipelineRunner(CellSource source, BaselineStore baselines, RunExecutor executor,
            DeferralRegistry deferrals, AuditTrail audit, Clock clock, int initialLookbackDays) {
        this(source, baselines, executor, deferrals, audit, clock, initialLookbackDays, new InMemoryRunStateStore());
    }

    /**
     * @throws IllegalStateException if saved state exists but cannot be read
     */
    public PipelineRunner(CellSource source, BaselineStore baselines, RunExecutor executor,
            DeferralRegistry deferrals, AuditTrail audit, Clock clock, int initialLookbackDays,
            RunStateStore stateStore) {
        this.source = Objects.requireNonNull(source, "CellSource must not be null");
        this.baselines = Objects.requireNonNull(baselines, "BaselineStore must not be null");
        this.executor = Objects.requireNonNull(executor, "RunExecutor must not be null");
        this.deferrals = Objects.requireNonNull(deferrals, "DeferralRegistry must not be null");
        this.audit = Objects.requireNonNull(audit, "AuditTrail must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (initialLookbackDays < 0) {
            throw new IllegalArgumentException("initialLookbackDays must be >= 0, got " + initialLookbackDays);
        }
        this.initialLookbackDays = initialLookbackDays;
        this.stateStore = Objects.requireNonNull(stateStore, "RunStateStore must not be null");
        stateStore.load().ifPresent(this::restore);
    }

    private void restore(RunState state) {
        cursor = state.getCursor();
        for (RunState.TrackedCell cell : state.getCells()) {
            if (cell.getFingerprint() != null) {
                fingerprints.put(cell.getKey(), cell.getFingerprint());
            }
            deferrals.restore(cell.getKey(), cell.getDeferrals());
        }
        LOG.info("Restored run state: cursor {}, {} processed cell(s), {} deferred", cursor,
                fingerprints.size(), deferrals.size());
    }

    /**
     * Execute one pass.
     *
     * @param trigger {@link #TRIGGER_SCHEDULED} or {@link #TRIGGER_MANUAL}
     * @return the final report; never {@code null}, also for failed runs
     */
    public synchronized RunReport run(String trigger) {
        Instant startedAt = clock.instant();
        String runId = "run-" + RUN_ID_FORMAT.format(startedAt) + "-" + sequence.incrementAndGet();
        LocalDate cursorBefore = effectiveCursor(startedAt);
        RunReport.Builder report = RunReport.builder(runId, trigger, startedAt);
        current = report.cursors(cursorBefore, cursorBefore).build();

        List<CellTask> tasks;
        try {
            int available = source.refresh();
            LOG.debug("Cell source reports {} cell(s) available", available);
            tasks = pendingTasks(scanFrom(cursorBefore, startedAt));
        } catch (RuntimeException e) {
            LOG.error("Run {} could not read pending cells", runId, e);
            return finish(report.finished(RunStatus.FAILED, clock.instant(), e.getMessage()));
        }
        report.pending(tasks.size());
        LOG.info("Run {} ({}) started: {} pending cell(s) after cursor {}, {} deferred",
                runId, trigger, tasks.size(), cursorBefore, deferrals.size());

        List<CellOutcome> outcomes;
        try {
            List<MetricCell> cells = tasks.stream().map(CellTask::getCell).toList();
            BaselineSnapshot snapshot = baselines.snapshot(cells, startedAt);
            outcomes = executor.execute(tasks, new RunContext(runId, startedAt, snapshot));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Run {} interrupted", runId, e);
            return finish(report.finished(RunStatus.FAILED, clock.instant(), "interrupted"));
        } catch (Exception e) {
            LOG.error("Run {} failed in the executor", runId, e);
            return finish(report.finished(RunStatus.FAILED, clock.instant(), e.getMessage()));
        }

        Instant finishedAt = clock.instant();
        for (CellOutcome outcome : outcomes) {
            track(outcome);
            audit.record(runId, finishedAt, outcome);
        }

        remember(tasks, outcomes);
        LocalDate cursorAfter = advanceCursor(cursorBefore, tasks, outcomes);
        cursor = cursorAfter;
        report.cursors(cursorBefore, cursorAfter).outcomes(outcomes);
        forgetBefore(earlier(cursorAfter, windowStart(startedAt)));

        try {
            stateStore.save(snapshotState());
        } catch (RuntimeException e) {
            LOG.error("Run {} could not save run state", runId, e);
            return finish(report.finished(RunStatus.FAILED, finishedAt,
                    "run state could not be saved: " + e.getMessage()));
        }

        long retryable = outcomes.stream().filter(CellOutcome::isRetryable).count();
        if (retryable > 0) {
            return finish(report.finished(RunStatus.FAILED, finishedAt,
                    retryable + " cell(s) could not be persisted and will be retried"));
        }
        return finish(report.finished(RunStatus.SUCCEEDED, finishedAt, null));
    }

    private RunReport finish(RunReport.Builder builder) {
        RunReport report = builder.build();
        current = null;
        synchronized (history) {
            history.addFirst(report);
            while (history.size() > HISTORY_SIZE) {
                history.removeLast();
            }
        }
        if (report.getStatus() == RunStatus.SUCCEEDED) {
            LOG.info("Run {} finished: {}", report.getRunId(), report);
        } else {
            LOG.error("Run {} failed: {}", report.getRunId(), report);
        }
        return report;
    }

    private LocalDate effectiveCursor(Instant now) {
        LocalDate c = cursor;
        return c != null ? c : windowStart(now);
    }

    private LocalDate windowStart(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).minusDays(initialLookbackDays + 1L);
    }

    private LocalDate scanFrom(LocalDate cursorBefore, Instant now) {
        return earlier(cursorBefore, windowStart(now));
    }

    private static LocalDate earlier(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    List<CellTask> pendingTasks(LocalDate scanFrom) {
        Map<CellKey, CellTask> tasks = new TreeMap<>();
        for (MetricCell cell : source.findAfter(scanFrom)) {
            CellKey key = cell.getKey();
            int priorDeferrals = deferrals.deferralsOf(key);
            if (priorDeferrals > 0 || !codec.fingerprint(cell).equals(fingerprints.get(key))) {
                tasks.put(key, new CellTask(cell, priorDeferrals));
            }
        }
        for (Map.Entry<CellKey, Integer> deferred : deferrals.pending().entrySet()) {
            if (tasks.containsKey(deferred.getKey())) {
                continue;
            }
            Optional<MetricCell> cell = source.find(deferred.getKey());
            if (cell.isPresent()) {
                tasks.put(deferred.getKey(), new CellTask(cell.get(), deferred.getValue()));
            } else {
                LOG.warn("Deferred cell {} no longer available, dropping it", deferred.getKey());
                deferrals.clear(deferred.getKey());
            }
        }
        return new ArrayList<>(tasks.values());
    }

    private void track(CellOutcome outcome) {
        switch (outcome.getKind()) {
            case DEFERRED -> deferrals.recordDeferral(outcome.getKey());
            case FAILED -> {
                if (!outcome.isRetryable()) {
                    deferrals.clear(outcome.getKey());
                }
            }
            default -> deferrals.clear(outcome.getKey());
        }
    }

    /**
     * Record the processed version of every cell that reached an outcome. A
     * retryable failure leaves the cell unrecorded so it stays pending.
     */
    private void remember(List<CellTask> tasks, List<CellOutcome> outcomes) {
        Map<CellKey, CellTask> byKey = new TreeMap<>();
        for (CellTask task : tasks) {
            byKey.put(task.getKey(), task);
        }
        for (CellOutcome outcome : outcomes) {
            CellTask task = byKey.get(outcome.getKey());
            if (task == null) {
                continue;
            }
            if (outcome.isRetryable()) {
                fingerprints.remove(outcome.getKey());
            } else {
                fingerprints.put(outcome.getKey(), codec.fingerprint(task.getCell()));
            }
        }
    }

    /** Drop fingerprints no later scan can reach. */
    private void forgetBefore(LocalDate horizon) {
        fingerprints.keySet().removeIf(key -> !key.getTimeBucket().isAfter(horizon));
    }

    private RunState snapshotState() {
        Map<CellKey, Integer> deferred = deferrals.pending();
        Map<CellKey, RunState.TrackedCell> cells = new TreeMap<>();
        fingerprints.forEach((key, fingerprint) ->
                cells.put(key, new RunState.TrackedCell(key, fingerprint, deferred.getOrDefault(key, 0))));
        deferred.forEach((key, count) -> cells.putIfAbsent(key, new RunState.TrackedCell(key, null, count)));

        RunState state = new RunState();
        state.setCursor(cursor);
        state.setCells(new ArrayList<>(cells.values()));
        return state;
    }

    static LocalDate advanceCursor(LocalDate before, List<CellTask> tasks, List<CellOutcome> outcomes) {
        LocalDate latest = before;
        for (CellTask task : tasks) {
            LocalDate bucket = task.getKey().getTimeBucket();
            if (latest == null || bucket.isAfter(latest)) {
                latest = bucket;
            }
        }
        for (CellOutcome outcome : outcomes) {
            if (!outcome.isRetryable()) {
                continue;
            }
            LocalDate limit = outcome.getKey().getTimeBucket().minusDays(1);
            if (latest == null || limit.isBefore(latest)) {
                latest = limit;
            }
        }
        if (before != null && latest != null && latest.isBefore(before)) {
            return before;
        }
        return latest;
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    /** The report of the run in progress, if any. */
    public Optional<RunReport> currentRun() {
        return Optional.ofNullable(current);
    }

    public Optional<RunReport> lastRun() {
        synchronized (history) {
            return Optional.ofNullable(history.peekFirst());
        }
    }

    /** Most recent first. */
    public List<RunReport> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public Optional<LocalDate> getCursor() {
        return Optional.ofNullable(cursor);
    }

    public DeferralRegistry getDeferrals() {
        return deferrals;
    }

    public AuditTrail getAudit() {
        return audit;
    }
}
