package com.outbreaksentinel.core.validation;

import java.util.Objects;

/**
 * The {@code (Case', Verdict)} pair returned by a {@link ValidationStage}.
 */
public final class StageOutcome {

    private final Case next;
    private final StageVerdict verdict;

    public StageOutcome(Case next, StageVerdict verdict) {
        this.next = Objects.requireNonNull(next, "next case must not be null");
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
    }

    public Case getNext() {
        return next;
    }

    public StageVerdict getVerdict() {
        return verdict;
    }
}
