package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.alert.AlertLifecycleManager;
import com.outbreaksentinel.core.alert.AlertPersistenceException;
import com.outbreaksentinel.core.alert.MaterializationResult;
import com.outbreaksentinel.core.baseline.LocationBaseline;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.fusion.FusionEngine;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.ScoreContractViolation;
import com.outbreaksentinel.core.model.ScoreVector;
import com.outbreaksentinel.core.narrative.TimeBoundedNarrator;
import com.outbreaksentinel.core.notify.DispatchOutcome;
import com.outbreaksentinel.core.notify.NotificationDispatcher;
import com.outbreaksentinel.core.scoring.ScoringEngine;
import com.outbreaksentinel.core.validation.Case;
import com.outbreaksentinel.core.validation.EvidenceAssembler;
import com.outbreaksentinel.core.validation.PipelineDecision;
import com.outbreaksentinel.core.validation.ValidationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one cell end to end: score, fuse, screen, validate, materialize and
 * notify.
 *
 * <h3>Failure isolation</h3>
 * <p>
 * {@link #process} never throws. A contract violation in scoring or fusion
 * fails the cell and the cell is skipped; a persistence failure after
 * retries fails the cell as retryable so the next run picks it up again. A
 * notification failure is recorded on an otherwise escalated outcome.
 * </p>
 *
 * <p>
 * Instances are stateless apart from their collaborators and may be shared
 * by threads processing different locations.
 * </p>
 *
 * @since 1.0.0
 */
public class CellProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(CellProcessor.class);

    private final ScoringEngine scoring;
    private final FusionEngine fusion;
    private final EvidenceAssembler evidence;
    private final ValidationPipeline validation;
    private final AlertLifecycleManager lifecycle;
    private final NotificationDispatcher dispatcher;
    private final double screeningThreshold;

    public CellProcessor(ScoringEngine scoring, FusionEngine fusion, EvidenceAssembler evidence,
            ValidationPipeline validation, AlertLifecycleManager lifecycle, NotificationDispatcher dispatcher,
            double screeningThreshold) {
        this.scoring = Objects.requireNonNull(scoring, "ScoringEngine must not be null");
        this.fusion = Objects.requireNonNull(fusion, "FusionEngine must not be null");
        this.evidence = Objects.requireNonNull(evidence, "EvidenceAssembler must not be null");
        this.validation = Objects.requireNonNull(validation, "ValidationPipeline must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "AlertLifecycleManager must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "NotificationDispatcher must not be null");
        if (screeningThreshold < 0.0 || screeningThreshold > 1.0) {
            throw new IllegalArgumentException("screeningThreshold must be in [0,1], got " + screeningThreshold);
        }
        this.screeningThreshold = screeningThreshold;
    }

    /**
     * Standard processor wired from pipeline settings.
     */
    public static CellProcessor fromSettings(PipelineSettings settings, TimeBoundedNarrator narrator,
            AlertLifecycleManager lifecycle, NotificationDispatcher dispatcher) {
        return new CellProcessor(
                ScoringEngine.fromSettings(settings),
                FusionEngine.fromSettings(settings),
                new EvidenceAssembler(),
                ValidationPipeline.standard(settings, narrator),
                lifecycle,
                dispatcher,
                settings.getScreeningThreshold());
    }

    public CellOutcome process(CellTask task, RunContext context) {
        MetricCell cell = task.getCell();
        try {
            return evaluate(task, context);
        } catch (ScoreContractViolation e) {
            LOG.error("Contract violation for {}, cell skipped", cell.getKey(), e);
            return CellOutcome.builder(cell.getKey(), CellOutcome.Kind.FAILED)
                    .priorDeferrals(task.getPriorDeferrals())
                    .failure(e.getMessage(), false)
                    .build();
        } catch (AlertPersistenceException e) {
            LOG.error("Could not persist alert for {} after {} attempt(s), cell left for the next run",
                    cell.getKey(), e.getAttempts(), e);
            return CellOutcome.builder(cell.getKey(), CellOutcome.Kind.FAILED)
                    .priorDeferrals(task.getPriorDeferrals())
                    .failure(e.getMessage(), true)
                    .build();
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure processing {}, cell skipped", cell.getKey(), e);
            return CellOutcome.builder(cell.getKey(), CellOutcome.Kind.FAILED)
                    .priorDeferrals(task.getPriorDeferrals())
                    .failure(e.getClass().getSimpleName() + ": " + e.getMessage(), false)
                    .build();
        }
    }

    private CellOutcome evaluate(CellTask task, RunContext context) {
        MetricCell cell = task.getCell();
        LocationBaseline baseline = context.getBaseline().baselineFor(cell.getLocation(), cell.getTimeBucket());
        ScoreVector vector = scoring.score(cell, baseline);
        FusionResult fused = fusion.fuse(vector);
        LOG.debug("{} fused: composite={} confidence={} valid={}/{}", cell.getKey(),
                fused.getCompositeScore(), fused.getConfidence(), fused.getValidDetectors(),
                fused.getTotalDetectors());

        if (!screensIn(fused)) {
            return CellOutcome.builder(cell.getKey(), CellOutcome.Kind.SCREENED_OUT)
                    .priorDeferrals(task.getPriorDeferrals())
                    .scores(fused.getCompositeScore(), fused.getConfidence())
                    .rationale(String.format(Locale.ROOT, "composite %.3f below screening threshold %.2f"
                            + " or no valid detector", fused.getCompositeScore(), screeningThreshold))
                    .build();
        }

        Case screened = Case.open(context.getRunId(), cell, fused, evidence.assemble(cell, fused),
                task.getPriorDeferrals());
        PipelineDecision decision = validation.run(screened);
        Case decided = decision.getCase();

        CellOutcome.Builder outcome = CellOutcome.builder(cell.getKey(), kindOf(decision))
                .priorDeferrals(task.getPriorDeferrals())
                .scores(fused.getCompositeScore(), fused.getConfidence())
                .verdicts(decision.getVerdicts())
                .rationale(decision.getRationale());
        if (!decision.isEscalated()) {
            return outcome.build();
        }

        MaterializationResult materialized = lifecycle.materialize(decided);
        outcome.severity(materialized.getAlert().getSeverity())
                .alert(materialized.getAlert().getAlertId(),
                        materialized.getKind().name().toLowerCase(Locale.ROOT))
                .notified(materialized.getAlert().isNotified());
        try {
            Optional<DispatchOutcome> dispatched = dispatcher.onMaterialized(materialized);
            dispatched.filter(DispatchOutcome::isMarkedNotified).ifPresent(d -> outcome.notified(true));
        } catch (RuntimeException e) {
            LOG.warn("Notification for alert {} failed, alert stays un-notified",
                    materialized.getAlert().getAlertId(), e);
            outcome.failure("notification failed: " + e.getMessage(), false);
        }
        return outcome.build();
    }

    boolean screensIn(FusionResult fused) {
        return fused.isFusable() && fused.getCompositeScore() >= screeningThreshold;
    }

    private static CellOutcome.Kind kindOf(PipelineDecision decision) {
        return switch (decision.getOutcome()) {
            case ESCALATED -> CellOutcome.Kind.ESCALATED;
            case SUPPRESSED -> CellOutcome.Kind.SUPPRESSED;
            case DEFERRED -> CellOutcome.Kind.DEFERRED;
            default -> throw new IllegalStateException("Non-terminal decision " + decision.getOutcome());
        };
    }
}
