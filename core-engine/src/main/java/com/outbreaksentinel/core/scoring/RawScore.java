package com.outbreaksentinel.core.scoring;

import java.util.Objects;

/**
 * Output of one {@link DetectorScorer}: a raw statistic, or the reason the
 * detector could not score the cell.
 */
public final class RawScore {

    private final double raw;
    private final boolean valid;
    private final String reason;

    private RawScore(double raw, boolean valid, String reason) {
        this.raw = raw;
        this.valid = valid;
        this.reason = reason;
    }

    /**
     * @param raw finite raw statistic
     * @throws IllegalArgumentException if {@code raw} is NaN or infinite
     */
    public static RawScore of(double raw) {
        if (!Double.isFinite(raw)) {
            throw new IllegalArgumentException("Raw score must be finite, got: " + raw);
        }
        return new RawScore(raw, true, null);
    }

    public static RawScore invalid(String reason) {
        return new RawScore(Double.NaN, false, Objects.requireNonNull(reason, "reason must not be null"));
    }

    /**
     * @return the raw statistic; {@code NaN} when invalid
     */
    public double getRaw() {
        return raw;
    }

    public boolean isValid() {
        return valid;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return valid ? "RawScore{" + raw + '}' : "RawScore{invalid: " + reason + '}';
    }
}
