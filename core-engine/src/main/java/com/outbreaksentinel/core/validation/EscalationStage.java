package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.SourceCategory;
import com.outbreaksentinel.core.narrative.TimeBoundedNarrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Final stage: severity, recommended actions, narrative and the terminal
 * verdict.
 *
 * <ol>
 * <li>Suppress when confidence is below the escalation floor.</li>
 * <li>Classify severity with {@link SeverityPolicy}, then apply the
 * environmental adjustment.</li>
 * <li>Select actions from the rule table.</li>
 * <li>Ask the narrator for a rationale, falling back to the numeric one.</li>
 * </ol>
 *
 * <p>
 * The verdict and its recorded rationale depend only on numbers; the
 * narrative is attached to the case separately.
 * </p>
 */
public class EscalationStage implements ValidationStage {

    private static final Logger LOG = LoggerFactory.getLogger(EscalationStage.class);

    private final SeverityPolicy severityPolicy;
    private final RecommendedActionPlanner planner;
    private final TimeBoundedNarrator narrator;
    private final double minConfidence;

    public EscalationStage(SeverityPolicy severityPolicy, RecommendedActionPlanner planner,
            TimeBoundedNarrator narrator, double minConfidence) {
        this.severityPolicy = Objects.requireNonNull(severityPolicy, "SeverityPolicy must not be null");
        this.planner = Objects.requireNonNull(planner, "RecommendedActionPlanner must not be null");
        this.narrator = Objects.requireNonNull(narrator, "TimeBoundedNarrator must not be null");
        this.minConfidence = minConfidence;
    }

    @Override
    public CaseState stage() {
        return CaseState.ESCALATION;
    }

    @Override
    public StageOutcome evaluate(Case current) {
        FusionResult fusion = current.getFusion();
        if (fusion.getConfidence() < minConfidence) {
            return new StageOutcome(current, StageVerdict.suppress(stage(), String.format(Locale.ROOT,
                    "confidence %.3f below escalation floor %.3f", fusion.getConfidence(), minConfidence)));
        }

        Severity base = severityPolicy.classify(fusion.getCompositeScore(), fusion.getConfidence());
        Severity severity = base.shift(current.getSeverityShift());

        EnvironmentalRiskAssessment risk = current.getEvidence().getEnvironmentalRisk();
        String envLevel = risk != null ? risk.getLevel().key() : RiskLevel.UNKNOWN.key();
        List<RecommendedAction> actions = planner.plan(severity, envLevel, current.getCorroborating());

        String rationale = numericRationale(fusion, base, severity, current);
        Case decided = current.toBuilder()
                .severity(severity)
                .actions(actions)
                .build();
        String narrative = narrator.narrate(decided, rationale);

        LOG.debug("Escalating {}: {}", current.getKey(), rationale);
        return new StageOutcome(decided.toBuilder().narrative(narrative).build(),
                StageVerdict.pass(stage(), rationale));
    }

    static String numericRationale(FusionResult fusion, Severity base, Severity severity, Case current) {
        String sources = current.getCorroborating().isEmpty()
                ? "none"
                : current.getCorroborating().stream().map(SourceCategory::key).collect(Collectors.joining(", "));
        String adjusted = base == severity ? "" : " (adjusted from " + base.key() + ")";
        return String.format(Locale.ROOT,
                "severity %s%s: composite %.3f, confidence %.3f, %d/%d detectors valid, corroborated by %s",
                severity.key(), adjusted, fusion.getCompositeScore(), fusion.getConfidence(),
                fusion.getValidDetectors(), fusion.getTotalDetectors(), sources);
    }
}
