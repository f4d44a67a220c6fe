package com.outbreaksentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One detector's contribution to a {@link ScoreVector}: raw score,
 * normalized score and validity.
 *
 * <p>
 * Invariant: a valid score always carries a normalized value in [0, 1]; an
 * invalid score never carries one. Construction enforces this and throws
 * {@link ScoreContractViolation} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectorId detector;
    private final Double raw;
    private final Double normalized;
    private final boolean valid;
    private final String reason;

    private DetectorScore(DetectorId detector, Double raw, Double normalized, boolean valid, String reason) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.raw = raw;
        this.normalized = normalized;
        this.valid = valid;
        this.reason = reason;

        if (valid) {
            if (normalized == null || normalized.isNaN() || normalized < 0.0 || normalized > 1.0) {
                throw new ScoreContractViolation("Normalized score for " + detector
                        + " must be in [0,1], got: " + normalized);
            }
        } else if (normalized != null) {
            throw new ScoreContractViolation("Invalid score for " + detector
                    + " must not carry a normalized value");
        }
    }

    public static DetectorScore valid(DetectorId detector, double raw, double normalized) {
        return new DetectorScore(detector, raw, normalized, true, null);
    }

    public static DetectorScore invalid(DetectorId detector, String reason) {
        return new DetectorScore(detector, null, null, false, reason);
    }

    public DetectorId getDetector() {
        return detector;
    }

    /**
     * @return raw score, or {@code null} when the detector could not score
     */
    public Double getRaw() {
        return raw;
    }

    /**
     * @return normalized score in [0, 1], or {@code null} when invalid
     */
    public Double getNormalized() {
        return normalized;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return why the detector could not score, or {@code null} when valid
     */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorScore that))
            return false;
        return valid == that.valid
                && detector.equals(that.detector)
                && Objects.equals(raw, that.raw)
                && Objects.equals(normalized, that.normalized);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detector, raw, normalized, valid);
    }

    @Override
    public String toString() {
        return valid
                ? detector + "{raw=" + raw + ", normalized=" + normalized + '}'
                : detector + "{invalid: " + reason + '}';
    }
}
