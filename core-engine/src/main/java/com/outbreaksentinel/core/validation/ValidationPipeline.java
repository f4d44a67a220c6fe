package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.narrative.TimeBoundedNarrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs a screened {@link Case} through an ordered list of
 * {@link ValidationStage}s.
 *
 * <h3>Transitions</h3>
 * <ul>
 * <li>{@code PASS} advances to the next stage; passing the last stage
 * escalates the case.</li>
 * <li>{@code SUPPRESS} ends the case immediately; no later stage runs.</li>
 * <li>{@code DEFER} halts the case for re-evaluation on a later run. A case
 * that has already been deferred {@code maxDeferCycles} times is suppressed
 * instead.</li>
 * </ul>
 *
 * <p>
 * Every verdict, including the synthetic one for exhausted deferrals, is
 * kept on the returned case for audit.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationPipeline.class);

    private final List<ValidationStage> stages;
    private final int maxDeferCycles;

    public ValidationPipeline(List<ValidationStage> stages, int maxDeferCycles) {
        Objects.requireNonNull(stages, "stages must not be null");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("ValidationPipeline requires at least one stage");
        }
        if (maxDeferCycles < 0) {
            throw new IllegalArgumentException("maxDeferCycles must be >= 0, got: " + maxDeferCycles);
        }
        this.stages = List.copyOf(stages);
        this.maxDeferCycles = maxDeferCycles;
    }

    /**
     * The standard four-stage pipeline.
     *
     * @param settings pipeline settings
     * @param narrator narrative source for the escalation stage
     * @return DataIntegrity → CrossSourceVerification → EnvironmentalRisk → Escalation
     */
    public static ValidationPipeline standard(PipelineSettings settings, TimeBoundedNarrator narrator) {
        return new ValidationPipeline(List.of(
                new DataIntegrityStage(settings.getIntegrity()),
                new CrossSourceVerificationStage(settings.getVerification(),
                        settings.getFusion().requiredSourceCategories()),
                new EnvironmentalRiskStage(settings.getEnvironment(), new EnvironmentalRiskAssessor()),
                new EscalationStage(new SeverityPolicy(settings.getEscalation()),
                        new RecommendedActionPlanner(settings.getActions()),
                        narrator,
                        settings.getEscalation().getMinConfidence())),
                settings.getDeferral().getMaxCycles());
    }

    /**
     * @param screened a case in {@link CaseState#SCREENING}
     * @return the terminal decision
     * @throws IllegalArgumentException if the case is not in screening
     */
    public PipelineDecision run(Case screened) {
        Objects.requireNonNull(screened, "Case must not be null");
        if (screened.getState() != CaseState.SCREENING) {
            throw new IllegalArgumentException("Case " + screened.getKey() + " must start in SCREENING, was "
                    + screened.getState());
        }

        Case current = screened;
        for (ValidationStage stage : stages) {
            StageOutcome outcome = stage.evaluate(current.toBuilder().state(stage.stage()).build());
            StageVerdict verdict = outcome.getVerdict();
            current = outcome.getNext().toBuilder().state(stage.stage()).verdict(verdict).build();

            switch (verdict.getVerdict()) {
                case PASS -> LOG.debug("{} passed {}: {}", current.getKey(), stage.stage(), verdict.getRationale());
                case SUPPRESS -> {
                    LOG.info("{} suppressed at {}: {}", current.getKey(), stage.stage(), verdict.getRationale());
                    return terminal(current, CaseState.SUPPRESSED);
                }
                case DEFER -> {
                    return defer(current, stage.stage(), verdict);
                }
                default -> throw new IllegalStateException("Unhandled verdict " + verdict.getVerdict());
            }
        }

        LOG.info("{} escalated with severity {}", current.getKey(), current.getSeverity());
        return terminal(current, CaseState.ESCALATED);
    }

    private PipelineDecision defer(Case current, CaseState stage, StageVerdict verdict) {
        if (current.getPriorDeferrals() >= maxDeferCycles) {
            StageVerdict exhausted = StageVerdict.suppress(stage, "deferred " + current.getPriorDeferrals()
                    + " time(s), limit " + maxDeferCycles + " reached: " + verdict.getRationale());
            LOG.info("{} suppressed at {}: {}", current.getKey(), stage, exhausted.getRationale());
            return terminal(current.toBuilder().verdict(exhausted).build(), CaseState.SUPPRESSED);
        }
        LOG.info("{} deferred at {} ({} of {}): {}", current.getKey(), stage,
                current.getPriorDeferrals() + 1, maxDeferCycles, verdict.getRationale());
        return terminal(current, CaseState.DEFERRED);
    }

    private static PipelineDecision terminal(Case current, CaseState state) {
        return new PipelineDecision(current.toBuilder().state(state).build());
    }

    public List<ValidationStage> getStages() {
        return stages;
    }

    public int getMaxDeferCycles() {
        return maxDeferCycles;
    }
}
