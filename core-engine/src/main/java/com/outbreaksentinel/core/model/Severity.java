package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Alert severity tiers, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Move {@code steps} tiers up (positive) or down (negative), clamped to
     * the ends of the scale.
     *
     * @param steps tiers to move
     * @return adjusted tier
     */
    public Severity shift(int steps) {
        int target = Math.max(0, Math.min(values().length - 1, ordinal() + steps));
        return values()[target];
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromKey(String key) {
        Objects.requireNonNull(key, "Severity key must not be null");
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + key
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
