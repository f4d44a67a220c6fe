package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate anomaly moving through the {@link ValidationPipeline}.
 *
 * <p>
 * Each stage returns a new {@code Case} derived with {@link #toBuilder()};
 * an instance is never modified after construction. A case belongs to the
 * run that screened it and is never shared between runs; only its verdicts
 * outlive it, for audit.
 * </p>
 *
 * <h3>Severity</h3>
 * <p>
 * The environmental stage records a tier adjustment in
 * {@link #getSeverityShift()}; the escalation stage applies it to the tier
 * from the threshold table and sets {@link #getSeverity()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Case {

    private final String runId;
    private final MetricCell cell;
    private final FusionResult fusion;
    private final EvidenceBundle evidence;
    private final CaseState state;
    private final List<StageVerdict> verdicts;
    private final int priorDeferrals;
    private final int severityShift;
    private final Set<SourceCategory> corroborating;
    private final Severity severity;
    private final List<RecommendedAction> actions;
    private final String narrative;

    private Case(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId must not be null");
        this.cell = Objects.requireNonNull(b.cell, "cell must not be null");
        this.fusion = Objects.requireNonNull(b.fusion, "fusion must not be null");
        this.evidence = Objects.requireNonNull(b.evidence, "evidence must not be null");
        this.state = Objects.requireNonNull(b.state, "state must not be null");
        if (!cell.getKey().equals(fusion.getCellKey())) {
            throw new IllegalArgumentException("Fusion result " + fusion.getCellKey()
                    + " does not belong to cell " + cell.getKey());
        }
        this.verdicts = Collections.unmodifiableList(new ArrayList<>(b.verdicts));
        this.priorDeferrals = b.priorDeferrals;
        this.severityShift = b.severityShift;
        this.corroborating = b.corroborating.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(SourceCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(b.corroborating));
        this.severity = b.severity;
        this.actions = Collections.unmodifiableList(new ArrayList<>(b.actions));
        this.narrative = b.narrative;
    }

    /**
     * Open a case for a screened cell.
     *
     * @param runId          the run that screened the cell
     * @param cell           the cell
     * @param fusion         its fusion result
     * @param evidence       initial evidence
     * @param priorDeferrals how many earlier runs deferred this cell
     * @return a case in {@link CaseState#SCREENING}
     */
    public static Case open(String runId, MetricCell cell, FusionResult fusion, EvidenceBundle evidence,
            int priorDeferrals) {
        return new Builder()
                .runId(runId)
                .cell(cell)
                .fusion(fusion)
                .evidence(evidence)
                .state(CaseState.SCREENING)
                .priorDeferrals(priorDeferrals)
                .build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.runId = runId;
        b.cell = cell;
        b.fusion = fusion;
        b.evidence = evidence;
        b.state = state;
        b.verdicts = new ArrayList<>(verdicts);
        b.priorDeferrals = priorDeferrals;
        b.severityShift = severityShift;
        b.corroborating = corroborating.isEmpty()
                ? EnumSet.noneOf(SourceCategory.class)
                : EnumSet.copyOf(corroborating);
        b.severity = severity;
        b.actions = new ArrayList<>(actions);
        b.narrative = narrative;
        return b;
    }

    public CellKey getKey() {
        return cell.getKey();
    }

    /**
     * @return rationale of the most recent verdict, or empty if none yet
     */
    public String lastRationale() {
        return verdicts.isEmpty() ? "" : verdicts.get(verdicts.size() - 1).getRationale();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRunId() {
        return runId;
    }

    public MetricCell getCell() {
        return cell;
    }

    public FusionResult getFusion() {
        return fusion;
    }

    public EvidenceBundle getEvidence() {
        return evidence;
    }

    public CaseState getState() {
        return state;
    }

    public List<StageVerdict> getVerdicts() {
        return verdicts;
    }

    public int getPriorDeferrals() {
        return priorDeferrals;
    }

    public int getSeverityShift() {
        return severityShift;
    }

    public Set<SourceCategory> getCorroborating() {
        return corroborating;
    }

    /**
     * @return final severity, or {@code null} before the escalation stage
     */
    public Severity getSeverity() {
        return severity;
    }

    public List<RecommendedAction> getActions() {
        return actions;
    }

    /**
     * @return narrative rationale, or {@code null} before the escalation stage
     */
    public String getNarrative() {
        return narrative;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String runId;
        private MetricCell cell;
        private FusionResult fusion;
        private EvidenceBundle evidence;
        private CaseState state;
        private List<StageVerdict> verdicts = new ArrayList<>();
        private int priorDeferrals;
        private int severityShift;
        private Set<SourceCategory> corroborating = EnumSet.noneOf(SourceCategory.class);
        private Severity severity;
        private List<RecommendedAction> actions = new ArrayList<>();
        private String narrative;

        private Builder() {
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder cell(MetricCell cell) {
            this.cell = cell;
            return this;
        }

        public Builder fusion(FusionResult fusion) {
            this.fusion = fusion;
            return this;
        }

        public Builder evidence(EvidenceBundle evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder state(CaseState state) {
            this.state = state;
            return this;
        }

        public Builder verdict(StageVerdict verdict) {
            this.verdicts.add(Objects.requireNonNull(verdict, "verdict must not be null"));
            return this;
        }

        public Builder priorDeferrals(int priorDeferrals) {
            this.priorDeferrals = priorDeferrals;
            return this;
        }

        public Builder severityShift(int severityShift) {
            this.severityShift = severityShift;
            return this;
        }

        public Builder corroborating(Collection<SourceCategory> corroborating) {
            this.corroborating = corroborating.isEmpty()
                    ? EnumSet.noneOf(SourceCategory.class)
                    : EnumSet.copyOf(corroborating);
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder actions(List<RecommendedAction> actions) {
            this.actions = new ArrayList<>(actions);
            return this;
        }

        public Builder narrative(String narrative) {
            this.narrative = narrative;
            return this;
        }

        public Case build() {
            return new Case(this);
        }
    }

    @Override
    public String toString() {
        return "Case{" + cell.getKey() +
                ", state=" + state +
                ", composite=" + fusion.getCompositeScore() +
                ", confidence=" + fusion.getConfidence() +
                ", severity=" + severity +
                '}';
    }
}
