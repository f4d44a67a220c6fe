package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.validation.StageVerdict;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * What happened to one cell in one run.
 *
 * <p>
 * Suppressed and deferred outcomes keep the full verdict trail so they stay
 * auditable even though no alert exists for them.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellOutcome implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Composite score below the screening threshold or not fusable. */
        SCREENED_OUT,
        ESCALATED,
        SUPPRESSED,
        DEFERRED,
        FAILED
    }

    private final CellKey key;
    private final Kind kind;
    private final int priorDeferrals;
    private final double compositeScore;
    private final double confidence;
    private final Severity severity;
    private final List<StageVerdict> verdicts;
    private final String rationale;
    private final String alertId;
    private final String materialization;
    private final boolean notified;
    private final boolean retryable;
    private final String error;

    private CellOutcome(Builder b) {
        this.key = Objects.requireNonNull(b.key, "key must not be null");
        this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
        this.priorDeferrals = b.priorDeferrals;
        this.compositeScore = b.compositeScore;
        this.confidence = b.confidence;
        this.severity = b.severity;
        this.verdicts = List.copyOf(b.verdicts);
        this.rationale = b.rationale;
        this.alertId = b.alertId;
        this.materialization = b.materialization;
        this.notified = b.notified;
        this.retryable = b.retryable;
        this.error = b.error;
    }

    static Builder builder(CellKey key, Kind kind) {
        return new Builder(key, kind);
    }

    /** Whether the cell must be picked up again by the next run. */
    public boolean isRetryable() {
        return retryable;
    }

    public CellKey getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    public int getPriorDeferrals() {
        return priorDeferrals;
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public Severity getSeverity() {
        return severity;
    }

    public List<StageVerdict> getVerdicts() {
        return verdicts;
    }

    public String getRationale() {
        return rationale;
    }

    public String getAlertId() {
        return alertId;
    }

    /** {@code created}, {@code merged} or {@code unchanged}; {@code null} unless escalated. */
    public String getMaterialization() {
        return materialization;
    }

    public boolean isNotified() {
        return notified;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "CellOutcome{" + key + " " + kind
                + (severity != null ? " severity=" + severity.key() : "")
                + (alertId != null ? " alert=" + alertId : "")
                + (rationale != null ? " rationale='" + rationale + "'" : "")
                + (error != null ? " error='" + error + "'" : "") + '}';
    }

    static final class Builder {
        private final CellKey key;
        private final Kind kind;
        private int priorDeferrals;
        private double compositeScore;
        private double confidence;
        private Severity severity;
        private List<StageVerdict> verdicts = List.of();
        private String rationale;
        private String alertId;
        private String materialization;
        private boolean notified;
        private boolean retryable;
        private String error;

        private Builder(CellKey key, Kind kind) {
            this.key = key;
            this.kind = kind;
        }

        Builder priorDeferrals(int priorDeferrals) {
            this.priorDeferrals = priorDeferrals;
            return this;
        }

        Builder scores(double compositeScore, double confidence) {
            this.compositeScore = compositeScore;
            this.confidence = confidence;
            return this;
        }

        Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        Builder verdicts(List<StageVerdict> verdicts) {
            this.verdicts = verdicts;
            return this;
        }

        Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        Builder alert(String alertId, String materialization) {
            this.alertId = alertId;
            this.materialization = materialization;
            return this;
        }

        Builder notified(boolean notified) {
            this.notified = notified;
            return this;
        }

        Builder failure(String error, boolean retryable) {
            this.error = error;
            this.retryable = retryable;
            return this;
        }

        CellOutcome build() {
            return new CellOutcome(this);
        }
    }
}
