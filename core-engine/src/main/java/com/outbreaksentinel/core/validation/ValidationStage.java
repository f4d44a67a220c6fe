package com.outbreaksentinel.core.validation;

/**
 * One step of the {@link ValidationPipeline}.
 *
 * <p>
 * A stage is a function of the case it receives: it may enrich the case
 * (evidence, severity adjustment, actions) and returns the enriched case with
 * its verdict. Verdicts are derived from numeric thresholds only.
 * </p>
 */
public interface ValidationStage {

    /**
     * @return the state a case is in while this stage evaluates it
     */
    CaseState stage();

    /**
     * @param current case entering the stage
     * @return the (possibly enriched) case and the stage verdict
     */
    StageOutcome evaluate(Case current);
}
