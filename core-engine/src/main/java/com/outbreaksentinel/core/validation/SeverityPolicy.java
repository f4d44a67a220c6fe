package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.Severity;

import java.util.Objects;

/**
 * Fixed threshold table from (composite score, confidence) to severity tier.
 * Both values must reach a tier's thresholds for the tier to apply.
 */
public class SeverityPolicy {

    private final PipelineSettings.Escalation thresholds;

    public SeverityPolicy(PipelineSettings.Escalation thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "Escalation settings must not be null");
    }

    public Severity classify(double composite, double confidence) {
        if (composite >= thresholds.getCriticalScore() && confidence >= thresholds.getCriticalConfidence()) {
            return Severity.CRITICAL;
        }
        if (composite >= thresholds.getHighScore() && confidence >= thresholds.getHighConfidence()) {
            return Severity.HIGH;
        }
        if (composite >= thresholds.getMediumScore() && confidence >= thresholds.getMediumConfidence()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
