package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Second stage: does more than one source category see the anomaly?
 *
 * <p>
 * A category corroborates when its signal reaches
 * {@code corroborationThreshold}.
 * </p>
 * <ul>
 * <li><b>pass</b> with at least {@code minCorroboratingSources}
 * corroborating categories, or with a single corroborating category when the
 * composite score reaches {@code singleSourceOverride}</li>
 * <li><b>defer</b> otherwise, while a required category has not reported</li>
 * <li><b>suppress</b> when every required category reported and corroboration
 * still fails</li>
 * </ul>
 */
public class CrossSourceVerificationStage implements ValidationStage {

    private final PipelineSettings.Verification settings;
    private final Set<SourceCategory> requiredCategories;

    public CrossSourceVerificationStage(PipelineSettings.Verification settings,
            Collection<SourceCategory> requiredCategories) {
        this.settings = Objects.requireNonNull(settings, "Verification settings must not be null");
        this.requiredCategories = requiredCategories.isEmpty()
                ? EnumSet.noneOf(SourceCategory.class)
                : EnumSet.copyOf(requiredCategories);
    }

    @Override
    public CaseState stage() {
        return CaseState.CROSS_SOURCE_VERIFICATION;
    }

    @Override
    public StageOutcome evaluate(Case current) {
        FusionResult fusion = current.getFusion();

        Set<SourceCategory> corroborating = EnumSet.noneOf(SourceCategory.class);
        fusion.getSourceSignals().forEach((category, signal) -> {
            if (signal >= settings.getCorroborationThreshold()) {
                corroborating.add(category);
            }
        });
        Case next = current.toBuilder().corroborating(corroborating).build();

        if (corroborating.size() >= settings.getMinCorroboratingSources()) {
            return new StageOutcome(next, StageVerdict.pass(stage(),
                    "corroborated by " + keys(corroborating)));
        }
        if (!corroborating.isEmpty() && fusion.getCompositeScore() >= settings.getSingleSourceOverride()) {
            return new StageOutcome(next, StageVerdict.pass(stage(),
                    "single-source override: composite " + fusion.getCompositeScore()
                            + " >= " + settings.getSingleSourceOverride() + " from " + keys(corroborating)));
        }

        Set<SourceCategory> missing = EnumSet.noneOf(SourceCategory.class);
        missing.addAll(requiredCategories);
        missing.removeAll(fusion.getSourcesWithData());
        String seen = corroborating.isEmpty() ? "no category" : keys(corroborating);
        if (!missing.isEmpty()) {
            return new StageOutcome(next, StageVerdict.defer(stage(),
                    "insufficient corroboration (" + seen + "); awaiting data from " + keys(missing)));
        }
        return new StageOutcome(next, StageVerdict.suppress(stage(),
                "insufficient corroboration (" + seen + ") with all sources reporting"));
    }

    private static String keys(Set<SourceCategory> categories) {
        return categories.stream().map(SourceCategory::key).collect(Collectors.joining(", "));
    }
}
