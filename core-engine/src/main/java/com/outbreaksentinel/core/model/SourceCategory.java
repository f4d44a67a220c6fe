package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * The three independent signal families a {@link MetricCell} aggregates.
 *
 * @since 1.0.0
 */
public enum SourceCategory {

    /** Hospital visit events, broken down by symptom. */
    HOSPITAL,

    /** Social-media mentions, broken down by keyword. */
    SOCIAL,

    /** Environmental readings (vector index, rainfall, humidity, temperature). */
    ENVIRONMENT;

    /**
     * @return lowercase key used in JSON and YAML
     */
    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a category from its key, case-insensitively.
     *
     * @param key category key, e.g. {@code "hospital"}
     * @return matching category
     * @throws IllegalArgumentException if the key is unknown
     */
    @JsonCreator
    public static SourceCategory fromKey(String key) {
        Objects.requireNonNull(key, "Source category key must not be null");
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown source category: '" + key
                    + "'. Supported: hospital, social, environment", e);
        }
    }
}
