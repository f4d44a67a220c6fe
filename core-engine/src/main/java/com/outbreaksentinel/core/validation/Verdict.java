package com.outbreaksentinel.core.validation;

/**
 * Result of one validation stage.
 */
public enum Verdict {

    /** Advance to the next stage. */
    PASS,

    /** Discard the case; no later stage runs. */
    SUPPRESS,

    /** Halt the case and re-evaluate it on the next run. */
    DEFER
}
