package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.MetricCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.cell;
import static com.outbreaksentinel.core.TestCells.withEnvironment;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EnvironmentalRiskAssessor}.
 */
class EnvironmentalRiskAssessorTest {

    private final EnvironmentalRiskAssessor assessor = new EnvironmentalRiskAssessor();

    private EnvironmentalRiskAssessment assess(double vector, double rainfall, double humidity, double temperature) {
        MetricCell cell = withEnvironment(cell("district-1", TODAY, 10, 10), vector, rainfall, humidity, temperature);
        return assessor.assess(cell);
    }

    @Test
    @DisplayName("Should rate breeding conditions on every factor as critical")
    void criticalWhenEveryFactorFires() {
        EnvironmentalRiskAssessment risk = assess(8.0, 60.0, 70.0, 28.0);

        assertThat(risk.getLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(risk.getRiskScore()).isEqualTo(8.0);
        assertThat(risk.getFactors()).hasSize(4);
        assertThat(risk.getFactors().get(0)).isEqualTo("Very high mosquito index: 8.0/10");
    }

    @Test
    @DisplayName("Should rate a high vector index plus moderate rain as medium")
    void mediumForPartialFactors() {
        EnvironmentalRiskAssessment risk = assess(6.0, 30.0, 40.0, 20.0);

        assertThat(risk.getRiskScore()).isEqualTo(3.0);
        assertThat(risk.getLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    @DisplayName("Should rate unremarkable conditions as low")
    void lowWhenNothingFires() {
        EnvironmentalRiskAssessment risk = assess(1.0, 0.0, 40.0, 18.0);

        assertThat(risk.getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(risk.getRiskScore()).isZero();
        assertThat(risk.hasData()).isTrue();
        assertThat(risk.getRecommendation()).isEqualTo("Low environmental risk currently.");
    }

    @Test
    @DisplayName("Should report unknown risk without environment data")
    void unknownWithoutData() {
        EnvironmentalRiskAssessment risk = assessor.assess(cell("district-1", TODAY, 10, 10));

        assertThat(risk.getLevel()).isEqualTo(RiskLevel.UNKNOWN);
        assertThat(risk.hasData()).isFalse();
        assertThat(risk.getRecommendation()).isEqualTo("No environmental data available");
    }

    @Test
    @DisplayName("Should map score boundaries onto levels")
    void levelBoundaries() {
        assertThat(EnvironmentalRiskAssessor.levelFor(1.9)).isEqualTo(RiskLevel.LOW);
        assertThat(EnvironmentalRiskAssessor.levelFor(2.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(EnvironmentalRiskAssessor.levelFor(4.0)).isEqualTo(RiskLevel.HIGH);
        assertThat(EnvironmentalRiskAssessor.levelFor(6.0)).isEqualTo(RiskLevel.CRITICAL);
    }
}
