package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.EnvironmentReading;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Point-based environmental risk scoring.
 *
 * <table>
 * <caption>Risk points</caption>
 * <tr><th>Factor</th><th>Condition</th><th>Points</th></tr>
 * <tr><td>Vector index</td><td>&gt; 7 / &gt; 5</td><td>3 / 2</td></tr>
 * <tr><td>Rainfall</td><td>&gt; 50 mm / &gt; 20 mm</td><td>2 / 1</td></tr>
 * <tr><td>Humidity</td><td>60–80 %</td><td>2</td></tr>
 * <tr><td>Temperature</td><td>25–30 °C</td><td>1</td></tr>
 * </table>
 *
 * <p>
 * Level: critical ≥ 6, high ≥ 4, medium ≥ 2, low otherwise. The score is
 * capped at 10.
 * </p>
 */
public class EnvironmentalRiskAssessor {

    static final double MAX_RISK_SCORE = 10.0;

    public EnvironmentalRiskAssessment assess(MetricCell cell) {
        EnvironmentReading reading = cell.getEnvironment();
        if (!cell.hasSource(SourceCategory.ENVIRONMENT) || reading == null || !reading.hasAnyReading()) {
            return new EnvironmentalRiskAssessment(RiskLevel.UNKNOWN, 0.0, List.of(),
                    "No environmental data available", null);
        }

        List<String> factors = new ArrayList<>();
        double score = 0.0;

        Double vector = reading.getVectorIndex();
        if (vector != null) {
            if (vector > 7) {
                factors.add(format("Very high mosquito index: %.1f/10", vector));
                score += 3.0;
            } else if (vector > 5) {
                factors.add(format("High mosquito index: %.1f/10", vector));
                score += 2.0;
            }
        }

        Double rainfall = reading.getRainfallMm();
        if (rainfall != null) {
            if (rainfall > 50) {
                factors.add(format("Heavy rainfall: %.1fmm (increases mosquito breeding)", rainfall));
                score += 2.0;
            } else if (rainfall > 20) {
                factors.add(format("Moderate rainfall: %.1fmm", rainfall));
                score += 1.0;
            }
        }

        Double humidity = reading.getHumidityPct();
        if (humidity != null && humidity >= 60 && humidity <= 80) {
            factors.add(format("Optimal mosquito breeding humidity: %.1f%%", humidity));
            score += 2.0;
        }

        Double temperature = reading.getTemperatureC();
        if (temperature != null && temperature >= 25 && temperature <= 30) {
            factors.add(format("Optimal mosquito activity temperature: %.1f°C", temperature));
            score += 1.0;
        }

        RiskLevel level = levelFor(score);
        return new EnvironmentalRiskAssessment(level, Math.min(score, MAX_RISK_SCORE), factors,
                recommendationFor(level), reading);
    }

    static RiskLevel levelFor(double score) {
        if (score >= 6) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 4) {
            return RiskLevel.HIGH;
        }
        if (score >= 2) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static String recommendationFor(RiskLevel level) {
        return switch (level) {
            case HIGH, CRITICAL -> "High environmental risk for vector-borne diseases. "
                    + "Recommend increased surveillance and vector control measures.";
            case MEDIUM -> "Moderate environmental risk. Monitor situation closely.";
            default -> "Low environmental risk currently.";
        };
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
