package com.outbreaksentinel.core.runner;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;

/**
 * Per-run counts served by the status query. A failed run still reports how
 * far it got: {@link #getCellsProcessed()} out of {@link #getCellsPending()}.
 *
 * @since 1.0.0
 */
public final class RunReport {

    private final String runId;
    private final String trigger;
    private final RunStatus status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final LocalDate cursorBefore;
    private final LocalDate cursorAfter;
    private final int cellsPending;
    private final int cellsProcessed;
    private final int cellsScored;
    private final int screenedOut;
    private final int escalated;
    private final int suppressed;
    private final int deferred;
    private final int failed;
    private final int alertsCreated;
    private final int alertsMerged;
    private final String error;

    private RunReport(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId must not be null");
        this.trigger = b.trigger;
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.startedAt = Objects.requireNonNull(b.startedAt, "startedAt must not be null");
        this.finishedAt = b.finishedAt;
        this.cursorBefore = b.cursorBefore;
        this.cursorAfter = b.cursorAfter;
        this.cellsPending = b.cellsPending;
        this.cellsProcessed = b.cellsProcessed;
        this.cellsScored = b.cellsScored;
        this.screenedOut = b.screenedOut;
        this.escalated = b.escalated;
        this.suppressed = b.suppressed;
        this.deferred = b.deferred;
        this.failed = b.failed;
        this.alertsCreated = b.alertsCreated;
        this.alertsMerged = b.alertsMerged;
        this.error = b.error;
    }

    static Builder builder(String runId, String trigger, Instant startedAt) {
        return new Builder(runId, trigger, startedAt);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRunId() {
        return runId;
    }

    /** {@code scheduled} or {@code manual}. */
    public String getTrigger() {
        return trigger;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public LocalDate getCursorBefore() {
        return cursorBefore;
    }

    public LocalDate getCursorAfter() {
        return cursorAfter;
    }

    public int getCellsPending() {
        return cellsPending;
    }

    public int getCellsProcessed() {
        return cellsProcessed;
    }

    public int getCellsScored() {
        return cellsScored;
    }

    public int getScreenedOut() {
        return screenedOut;
    }

    public int getEscalated() {
        return escalated;
    }

    public int getSuppressed() {
        return suppressed;
    }

    public int getDeferred() {
        return deferred;
    }

    public int getFailed() {
        return failed;
    }

    public int getAlertsCreated() {
        return alertsCreated;
    }

    public int getAlertsMerged() {
        return alertsMerged;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "RunReport{runId='" + runId + "', status=" + status + ", processed=" + cellsProcessed + "/"
                + cellsPending + ", escalated=" + escalated + ", suppressed=" + suppressed + ", deferred="
                + deferred + ", failed=" + failed + ", screenedOut=" + screenedOut
                + (error != null ? ", error='" + error + "'" : "") + '}';
    }

    static final class Builder {
        private final String runId;
        private final String trigger;
        private final Instant startedAt;
        private RunStatus status = RunStatus.RUNNING;
        private Instant finishedAt;
        private LocalDate cursorBefore;
        private LocalDate cursorAfter;
        private int cellsPending;
        private int cellsProcessed;
        private int cellsScored;
        private int screenedOut;
        private int escalated;
        private int suppressed;
        private int deferred;
        private int failed;
        private int alertsCreated;
        private int alertsMerged;
        private String error;

        private Builder(String runId, String trigger, Instant startedAt) {
            this.runId = runId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }

        Builder cursors(LocalDate before, LocalDate after) {
            this.cursorBefore = before;
            this.cursorAfter = after;
            return this;
        }

        Builder pending(int cellsPending) {
            this.cellsPending = cellsPending;
            return this;
        }

        Builder outcomes(Collection<CellOutcome> outcomes) {
            cellsProcessed = outcomes.size();
            for (CellOutcome o : outcomes) {
                switch (o.getKind()) {
                    case SCREENED_OUT -> screenedOut++;
                    case ESCALATED -> escalated++;
                    case SUPPRESSED -> suppressed++;
                    case DEFERRED -> deferred++;
                    case FAILED -> failed++;
                    default -> throw new IllegalStateException("Unhandled outcome " + o.getKind());
                }
                if ("created".equals(o.getMaterialization())) {
                    alertsCreated++;
                } else if ("merged".equals(o.getMaterialization())) {
                    alertsMerged++;
                }
            }
            cellsScored = cellsProcessed - failed;
            return this;
        }

        Builder finished(RunStatus status, Instant finishedAt, String error) {
            this.status = status;
            this.finishedAt = finishedAt;
            this.error = error;
            return this;
        }

        RunReport build() {
            return new RunReport(this);
        }
    }
}
