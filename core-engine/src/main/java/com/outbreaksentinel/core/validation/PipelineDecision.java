package com.outbreaksentinel.core.validation;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of running a case through the {@link ValidationPipeline}.
 */
public final class PipelineDecision {

    private final Case finalCase;

    PipelineDecision(Case finalCase) {
        this.finalCase = Objects.requireNonNull(finalCase, "finalCase must not be null");
        if (!finalCase.getState().isTerminal()) {
            throw new IllegalStateException("Decision requires a terminal case, got " + finalCase.getState());
        }
    }

    public Case getCase() {
        return finalCase;
    }

    /**
     * @return {@link CaseState#ESCALATED}, {@link CaseState#SUPPRESSED} or
     *         {@link CaseState#DEFERRED}
     */
    public CaseState getOutcome() {
        return finalCase.getState();
    }

    public boolean isEscalated() {
        return finalCase.getState() == CaseState.ESCALATED;
    }

    public String getRationale() {
        return finalCase.lastRationale();
    }

    public List<StageVerdict> getVerdicts() {
        return finalCase.getVerdicts();
    }

    @Override
    public String toString() {
        return "PipelineDecision{" + finalCase.getKey() + " → " + getOutcome() + ": " + getRationale() + '}';
    }
}
