package com.outbreaksentinel.core.validation;

import java.util.Locale;

/**
 * Environmental risk tier; {@link #UNKNOWN} when the cell has no
 * environmental reading.
 */
public enum RiskLevel {
    UNKNOWN,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }
}
