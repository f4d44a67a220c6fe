package com.outbreaksentinel.core.validation;

/**
 * Position of a {@link Case} in the validation sequence.
 *
 * <pre>
 * SCREENING → DATA_INTEGRITY → CROSS_SOURCE_VERIFICATION
 *           → ENVIRONMENTAL_RISK → ESCALATION → ESCALATED
 * any stage ── suppress ──→ SUPPRESSED
 * any stage ── defer ────→ DEFERRED
 * </pre>
 */
public enum CaseState {
    SCREENING,
    DATA_INTEGRITY,
    CROSS_SOURCE_VERIFICATION,
    ENVIRONMENTAL_RISK,
    ESCALATION,
    ESCALATED,
    SUPPRESSED,
    DEFERRED;

    public boolean isTerminal() {
        return this == ESCALATED || this == SUPPRESSED || this == DEFERRED;
    }
}
