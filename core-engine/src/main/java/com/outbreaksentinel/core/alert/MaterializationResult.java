package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.model.Alert;

import java.util.Objects;

/**
 * What {@link AlertLifecycleManager#materialize} did with an escalated case.
 */
public final class MaterializationResult {

    public enum Kind {
        /** A new alert was inserted. */
        CREATED,
        /** Evidence was merged into an existing open alert. */
        MERGED,
        /** An existing alert already holds this exact evidence; nothing was written. */
        UNCHANGED
    }

    private final Alert alert;
    private final Kind kind;
    private final boolean severityRaised;

    private MaterializationResult(Alert alert, Kind kind, boolean severityRaised) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.severityRaised = severityRaised;
    }

    public static MaterializationResult created(Alert alert) {
        return new MaterializationResult(alert, Kind.CREATED, false);
    }

    public static MaterializationResult merged(Alert alert, boolean severityRaised) {
        return new MaterializationResult(alert, Kind.MERGED, severityRaised);
    }

    public static MaterializationResult unchanged(Alert alert) {
        return new MaterializationResult(alert, Kind.UNCHANGED, false);
    }

    public Alert getAlert() {
        return alert;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSeverityRaised() {
        return severityRaised;
    }

    /**
     * @return {@code true} for a new alert or a merge that raised severity
     */
    public boolean requiresNotification() {
        return kind == Kind.CREATED || severityRaised;
    }

    @Override
    public String toString() {
        return "MaterializationResult{" + kind + ", alert=" + alert.getAlertId()
                + ", severityRaised=" + severityRaised + '}';
    }
}
