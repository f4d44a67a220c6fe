package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of an anomaly detector.
 *
 * <p>
 * This is an <strong>open</strong> enumeration: the six built-in detectors are
 * exposed as constants, but any name can be wrapped with {@link #of(String)}
 * so that new detectors plug in without changing downstream contracts.
 * Names are normalised to lowercase.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorId implements Serializable, Comparable<DetectorId> {

    private static final long serialVersionUID = 1L;

    public static final DetectorId Z_SCORE = new DetectorId("z_score");
    public static final DetectorId CUSUM = new DetectorId("cusum");
    public static final DetectorId EWMA = new DetectorId("ewma");
    public static final DetectorId ISOLATION_FOREST = new DetectorId("isolation_forest");
    public static final DetectorId LSTM_AUTOENCODER = new DetectorId("lstm_autoencoder");
    public static final DetectorId PROPHET_RESIDUAL = new DetectorId("prophet_residual");

    /** The detectors shipped with the engine, in reporting order. */
    public static final List<DetectorId> BUILT_IN = List.of(
            Z_SCORE, CUSUM, EWMA, ISOLATION_FOREST, LSTM_AUTOENCODER, PROPHET_RESIDUAL);

    private final String name;

    private DetectorId(String name) {
        this.name = name;
    }

    /**
     * @param name detector name; must not be blank
     * @return detector identity for the (lowercased) name
     * @throws IllegalArgumentException if {@code name} is null or blank
     */
    @JsonCreator
    public static DetectorId of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Detector name must not be null or blank");
        }
        return new DetectorId(name.trim().toLowerCase(Locale.ROOT));
    }

    @JsonValue
    public String name() {
        return name;
    }

    @Override
    public int compareTo(DetectorId other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorId that))
            return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
