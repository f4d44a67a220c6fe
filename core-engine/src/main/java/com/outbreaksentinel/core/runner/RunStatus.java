package com.outbreaksentinel.core.runner;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    /** At least one cell could not be persisted, or the executor itself failed. */
    FAILED
}
