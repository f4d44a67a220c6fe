package com.outbreaksentinel.core.validation;

import java.io.Serializable;
import java.util.Objects;

/**
 * A stage's verdict together with the rationale recorded for audit.
 */
public final class StageVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CaseState stage;
    private final Verdict verdict;
    private final String rationale;

    public StageVerdict(CaseState stage, Verdict verdict, String rationale) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
        this.rationale = Objects.requireNonNull(rationale, "rationale must not be null");
    }

    public static StageVerdict pass(CaseState stage, String rationale) {
        return new StageVerdict(stage, Verdict.PASS, rationale);
    }

    public static StageVerdict suppress(CaseState stage, String rationale) {
        return new StageVerdict(stage, Verdict.SUPPRESS, rationale);
    }

    public static StageVerdict defer(CaseState stage, String rationale) {
        return new StageVerdict(stage, Verdict.DEFER, rationale);
    }

    public CaseState getStage() {
        return stage;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public String getRationale() {
        return rationale;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StageVerdict that)) {
            return false;
        }
        return stage == that.stage && verdict == that.verdict && rationale.equals(that.rationale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, verdict, rationale);
    }

    @Override
    public String toString() {
        return stage + ":" + verdict + " (" + rationale + ")";
    }
}
