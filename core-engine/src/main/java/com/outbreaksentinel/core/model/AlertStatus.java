package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Alert lifecycle states. The only legal moves are
 * {@code active → acknowledged → resolved}; {@code resolved} is terminal.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * @param target requested next status
     * @return {@code true} if moving from this status to {@code target} is legal
     */
    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case ACTIVE -> target == ACKNOWLEDGED;
            case ACKNOWLEDGED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }

    public boolean isOpen() {
        return this != RESOLVED;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromKey(String key) {
        Objects.requireNonNull(key, "Alert status must not be null");
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alert status: '" + key
                    + "'. Supported: active, acknowledged, resolved", e);
        }
    }
}
