package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.EnvironmentReading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Vector-borne disease risk derived from one day's environmental reading.
 */
public final class EnvironmentalRiskAssessment {

    private final RiskLevel level;
    private final double riskScore;
    private final List<String> factors;
    private final String recommendation;
    private final EnvironmentReading reading;

    public EnvironmentalRiskAssessment(RiskLevel level, double riskScore, List<String> factors,
            String recommendation, EnvironmentReading reading) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.riskScore = riskScore;
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation must not be null");
        this.reading = reading;
    }

    public boolean hasData() {
        return level != RiskLevel.UNKNOWN;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public List<String> getFactors() {
        return factors;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public EnvironmentReading getReading() {
        return reading;
    }

    /**
     * @return plain-map copy for evidence snapshots
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("risk_level", level.key());
        map.put("risk_score", riskScore);
        map.put("factors", new ArrayList<>(factors));
        map.put("recommendation", recommendation);
        if (reading != null) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("vector_index", reading.getVectorIndex());
            metrics.put("rainfall_mm", reading.getRainfallMm());
            metrics.put("humidity_pct", reading.getHumidityPct());
            metrics.put("temperature_c", reading.getTemperatureC());
            map.put("metrics", metrics);
        }
        return map;
    }

    @Override
    public String toString() {
        return "EnvironmentalRiskAssessment{" + level.key() + ", score=" + riskScore + ", factors=" + factors + '}';
    }
}
