package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.baseline.BaselineSnapshot;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Run-scoped state handed to every cell of one pipeline pass: the run
 * identifier, the instant the run started and the read-only baseline
 * snapshot taken at that instant.
 */
public final class RunContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String runId;
    private final Instant startedAt;
    private final BaselineSnapshot baseline;

    public RunContext(String runId, Instant startedAt, BaselineSnapshot baseline) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public BaselineSnapshot getBaseline() {
        return baseline;
    }

    @Override
    public String toString() {
        return "RunContext{runId='" + runId + "', startedAt=" + startedAt + ", baseline=" + baseline + '}';
    }
}
