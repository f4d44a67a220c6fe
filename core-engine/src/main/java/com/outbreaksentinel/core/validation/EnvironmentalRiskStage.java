package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;

import java.util.Objects;

/**
 * Third stage: attach the environmental risk assessment and adjust the
 * severity tier.
 *
 * <p>
 * High or critical environmental risk raises the final tier by one. In
 * {@code advisory} mode (the default) the stage always passes. In
 * {@code enforcing} mode it suppresses when a reading is present and its risk
 * score is at or below {@code contradictionMaxRisk}; a missing reading never
 * suppresses.
 * </p>
 */
public class EnvironmentalRiskStage implements ValidationStage {

    private final PipelineSettings.Environment settings;
    private final EnvironmentalRiskAssessor assessor;

    public EnvironmentalRiskStage(PipelineSettings.Environment settings, EnvironmentalRiskAssessor assessor) {
        this.settings = Objects.requireNonNull(settings, "Environment settings must not be null");
        this.assessor = Objects.requireNonNull(assessor, "EnvironmentalRiskAssessor must not be null");
    }

    @Override
    public CaseState stage() {
        return CaseState.ENVIRONMENTAL_RISK;
    }

    @Override
    public StageOutcome evaluate(Case current) {
        EnvironmentalRiskAssessment assessment = assessor.assess(current.getCell());

        int shift = 0;
        if (settings.isUpgradeOnHighRisk() && assessment.getLevel().isElevated()) {
            shift = 1;
        } else if (settings.isDowngradeOnLowRisk() && assessment.getLevel() == RiskLevel.LOW) {
            shift = -1;
        }

        Case next = current.toBuilder()
                .evidence(current.getEvidence().withEnvironmentalRisk(assessment))
                .severityShift(current.getSeverityShift() + shift)
                .build();

        String summary = "environmental risk " + assessment.getLevel().key()
                + " (score " + assessment.getRiskScore() + ")";
        if (settings.isEnforcing() && assessment.hasData()
                && assessment.getRiskScore() <= settings.getContradictionMaxRisk()) {
            return new StageOutcome(next, StageVerdict.suppress(stage(),
                    summary + " contradicts the outbreak hypothesis"));
        }
        String adjustment = shift > 0 ? ", severity +1" : shift < 0 ? ", severity -1" : "";
        return new StageOutcome(next, StageVerdict.pass(stage(), summary + adjustment));
    }
}
