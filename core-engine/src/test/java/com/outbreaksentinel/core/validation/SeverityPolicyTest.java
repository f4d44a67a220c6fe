package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeverityPolicy}.
 */
class SeverityPolicyTest {

    private final SeverityPolicy policy = new SeverityPolicy(new PipelineSettings().getEscalation());

    @Test
    @DisplayName("Should require both score and confidence for each tier")
    void requiresBothScoreAndConfidence() {
        assertThat(policy.classify(0.90, 0.80)).isEqualTo(Severity.CRITICAL);
        assertThat(policy.classify(0.90, 0.60)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.70, 0.90)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.50, 0.35)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(0.90, 0.25)).isEqualTo(Severity.LOW);
        assertThat(policy.classify(0.30, 0.90)).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Should treat thresholds as inclusive")
    void inclusiveThresholds() {
        assertThat(policy.classify(0.85, 0.75)).isEqualTo(Severity.CRITICAL);
        assertThat(policy.classify(0.65, 0.5)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.45, 0.3)).isEqualTo(Severity.MEDIUM);
    }
}
