package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Daily environmental aggregate for one location. Every reading is optional;
 * a {@code null} component means the sensor reported nothing for the day.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EnvironmentReading implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Vector-breeding (mosquito) risk index on a 0–10 scale. */
    private final Double vectorIndex;
    private final Double rainfallMm;
    private final Double humidityPct;
    private final Double temperatureC;

    @JsonCreator
    public EnvironmentReading(@JsonProperty("vectorIndex") Double vectorIndex,
            @JsonProperty("rainfallMm") Double rainfallMm,
            @JsonProperty("humidityPct") Double humidityPct,
            @JsonProperty("temperatureC") Double temperatureC) {
        this.vectorIndex = vectorIndex;
        this.rainfallMm = rainfallMm;
        this.humidityPct = humidityPct;
        this.temperatureC = temperatureC;
    }

    public Double getVectorIndex() {
        return vectorIndex;
    }

    public Double getRainfallMm() {
        return rainfallMm;
    }

    public Double getHumidityPct() {
        return humidityPct;
    }

    public Double getTemperatureC() {
        return temperatureC;
    }

    /**
     * @return {@code true} if at least one component carries a value
     */
    public boolean hasAnyReading() {
        return vectorIndex != null || rainfallMm != null || humidityPct != null || temperatureC != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnvironmentReading that))
            return false;
        return Objects.equals(vectorIndex, that.vectorIndex)
                && Objects.equals(rainfallMm, that.rainfallMm)
                && Objects.equals(humidityPct, that.humidityPct)
                && Objects.equals(temperatureC, that.temperatureC);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vectorIndex, rainfallMm, humidityPct, temperatureC);
    }

    @Override
    public String toString() {
        return "EnvironmentReading{" +
                "vectorIndex=" + vectorIndex +
                ", rainfallMm=" + rainfallMm +
                ", humidityPct=" + humidityPct +
                ", temperatureC=" + temperatureC +
                '}';
    }
}
