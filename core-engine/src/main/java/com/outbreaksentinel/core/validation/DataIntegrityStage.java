package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.EnvironmentReading;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * First stage: is the evidence structurally sound and large enough to judge?
 *
 * <ul>
 * <li><b>suppress</b> on range violations (negative counts, non-finite or
 * out-of-range environmental values) and on provenance flags that
 * contradict the counts</li>
 * <li><b>defer</b> when fewer than {@code minValidDetectors} detectors
 * could score or the day's event volume is below {@code minSampleSize}</li>
 * </ul>
 */
public class DataIntegrityStage implements ValidationStage {

    private final PipelineSettings.Integrity settings;

    public DataIntegrityStage(PipelineSettings.Integrity settings) {
        this.settings = Objects.requireNonNull(settings, "Integrity settings must not be null");
    }

    @Override
    public CaseState stage() {
        return CaseState.DATA_INTEGRITY;
    }

    @Override
    public StageOutcome evaluate(Case current) {
        MetricCell cell = current.getCell();

        List<String> violations = violations(cell);
        if (!violations.isEmpty()) {
            return new StageOutcome(current, StageVerdict.suppress(stage(),
                    "structurally invalid input: " + String.join("; ", violations)));
        }

        int valid = current.getFusion().getValidDetectors();
        if (valid < settings.getMinValidDetectors()) {
            return new StageOutcome(current, StageVerdict.defer(stage(),
                    "only " + valid + " valid detector(s), need " + settings.getMinValidDetectors()));
        }
        long volume = cell.getTotalEvents();
        if (volume < settings.getMinSampleSize()) {
            return new StageOutcome(current, StageVerdict.defer(stage(),
                    "sample size " + volume + " below minimum " + settings.getMinSampleSize()));
        }

        return new StageOutcome(current, StageVerdict.pass(stage(),
                valid + "/" + current.getFusion().getTotalDetectors() + " detectors valid, "
                        + volume + " events"));
    }

    List<String> violations(MetricCell cell) {
        List<String> errors = new ArrayList<>();

        if (cell.getHospitalEvents() < 0) {
            errors.add("negative hospital event count " + cell.getHospitalEvents());
        }
        if (cell.getSocialMentions() < 0) {
            errors.add("negative social mention count " + cell.getSocialMentions());
        }
        checkCounts(errors, "symptom", cell.getSymptomCounts());
        checkCounts(errors, "keyword", cell.getKeywordCounts());

        EnvironmentReading env = cell.getEnvironment();
        if (env != null) {
            checkValue(errors, "vector index", env.getVectorIndex(), 0.0, settings.getMaxVectorIndex());
            checkValue(errors, "rainfall", env.getRainfallMm(), 0.0, Double.MAX_VALUE);
            checkValue(errors, "humidity", env.getHumidityPct(), 0.0, 100.0);
            checkValue(errors, "temperature", env.getTemperatureC(), -90.0, 60.0);
        }

        // Provenance must agree with the counts.
        if (!cell.hasSource(SourceCategory.HOSPITAL)
                && (cell.getHospitalEvents() > 0 || !cell.getSymptomCounts().isEmpty())) {
            errors.add("hospital counts present but hospital source not flagged");
        }
        if (!cell.hasSource(SourceCategory.SOCIAL)
                && (cell.getSocialMentions() > 0 || !cell.getKeywordCounts().isEmpty())) {
            errors.add("social counts present but social source not flagged");
        }
        boolean envReading = env != null && env.hasAnyReading();
        if (cell.hasSource(SourceCategory.ENVIRONMENT) != envReading) {
            errors.add(envReading
                    ? "environment reading present but environment source not flagged"
                    : "environment source flagged without a reading");
        }
        return errors;
    }

    private static void checkCounts(List<String> errors, String kind, Map<String, Integer> counts) {
        counts.forEach((term, count) -> {
            if (count == null || count < 0) {
                errors.add("invalid " + kind + " count for '" + term + "': " + count);
            }
        });
    }

    private static void checkValue(List<String> errors, String name, Double value, double min, double max) {
        if (value == null) {
            return;
        }
        if (!Double.isFinite(value) || value < min || value > max) {
            errors.add(name + " out of range: " + value);
        }
    }
}
