package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.EnvironmentReading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence accumulated for a case: per-source summaries, detector scores,
 * cross-source correlations and, once the environmental stage has run, the
 * risk assessment.
 *
 * <p>
 * Immutable; stages derive enriched copies. {@link #toSnapshot()} produces
 * the detached plain-map form stored on the alert.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvidenceBundle {

    private final boolean hospitalData;
    private final int hospitalEvents;
    private final int uniqueSymptoms;
    private final Map<String, Integer> topSymptoms;

    private final boolean socialData;
    private final int socialMentions;
    private final int uniqueKeywords;
    private final Map<String, Integer> topKeywords;

    private final EnvironmentReading environment;
    private final Map<String, Double> modelScores;
    private final List<String> correlations;
    private final EnvironmentalRiskAssessment environmentalRisk;

    private EvidenceBundle(Builder b) {
        this.hospitalData = b.hospitalData;
        this.hospitalEvents = b.hospitalEvents;
        this.uniqueSymptoms = b.uniqueSymptoms;
        this.topSymptoms = Collections.unmodifiableMap(new LinkedHashMap<>(b.topSymptoms));
        this.socialData = b.socialData;
        this.socialMentions = b.socialMentions;
        this.uniqueKeywords = b.uniqueKeywords;
        this.topKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(b.topKeywords));
        this.environment = b.environment;
        this.modelScores = Collections.unmodifiableMap(new LinkedHashMap<>(b.modelScores));
        this.correlations = Collections.unmodifiableList(new ArrayList<>(b.correlations));
        this.environmentalRisk = b.environmentalRisk;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.hospitalData = hospitalData;
        b.hospitalEvents = hospitalEvents;
        b.uniqueSymptoms = uniqueSymptoms;
        b.topSymptoms = new LinkedHashMap<>(topSymptoms);
        b.socialData = socialData;
        b.socialMentions = socialMentions;
        b.uniqueKeywords = uniqueKeywords;
        b.topKeywords = new LinkedHashMap<>(topKeywords);
        b.environment = environment;
        b.modelScores = new LinkedHashMap<>(modelScores);
        b.correlations = new ArrayList<>(correlations);
        b.environmentalRisk = environmentalRisk;
        return b;
    }

    /**
     * Attach the environmental assessment, adding the surge-support
     * correlation when hospital data is present and the risk score exceeds 5.
     */
    public EvidenceBundle withEnvironmentalRisk(EnvironmentalRiskAssessment assessment) {
        Builder b = toBuilder().environmentalRisk(assessment);
        if (hospitalData && assessment.hasData() && assessment.getRiskScore() > 5.0
                && !correlations.contains(EvidenceAssembler.ENVIRONMENT_SUPPORTS_SURGE)) {
            b.correlation(EvidenceAssembler.ENVIRONMENT_SUPPORTS_SURGE);
        }
        return b.build();
    }

    /**
     * @return detached nested maps and lists, safe to persist and mutate
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> hospital = new LinkedHashMap<>();
        hospital.put("has_data", hospitalData);
        if (hospitalData) {
            hospital.put("total_events", hospitalEvents);
            hospital.put("unique_symptoms", uniqueSymptoms);
            hospital.put("top_symptoms", new LinkedHashMap<>(topSymptoms));
        }

        Map<String, Object> social = new LinkedHashMap<>();
        social.put("has_data", socialData);
        if (socialData) {
            social.put("total_mentions", socialMentions);
            social.put("unique_keywords", uniqueKeywords);
            social.put("top_keywords", new LinkedHashMap<>(topKeywords));
        }

        Map<String, Object> env = new LinkedHashMap<>();
        env.put("has_data", environment != null && environment.hasAnyReading());
        if (environment != null) {
            env.put("vector_index", environment.getVectorIndex());
            env.put("rainfall_mm", environment.getRainfallMm());
            env.put("humidity_pct", environment.getHumidityPct());
            env.put("temperature_c", environment.getTemperatureC());
        }
        if (environmentalRisk != null) {
            env.put("risk_assessment", environmentalRisk.toMap());
        }

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("hospital", hospital);
        snapshot.put("social", social);
        snapshot.put("environment", env);
        snapshot.put("model_scores", new LinkedHashMap<>(modelScores));
        snapshot.put("correlations", new ArrayList<>(correlations));
        return snapshot;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean hasHospitalData() {
        return hospitalData;
    }

    public int getHospitalEvents() {
        return hospitalEvents;
    }

    public int getUniqueSymptoms() {
        return uniqueSymptoms;
    }

    public Map<String, Integer> getTopSymptoms() {
        return topSymptoms;
    }

    public boolean hasSocialData() {
        return socialData;
    }

    public int getSocialMentions() {
        return socialMentions;
    }

    public int getUniqueKeywords() {
        return uniqueKeywords;
    }

    public Map<String, Integer> getTopKeywords() {
        return topKeywords;
    }

    public EnvironmentReading getEnvironment() {
        return environment;
    }

    public Map<String, Double> getModelScores() {
        return modelScores;
    }

    public List<String> getCorrelations() {
        return correlations;
    }

    /**
     * @return the assessment, or {@code null} before the environmental stage
     */
    public EnvironmentalRiskAssessment getEnvironmentalRisk() {
        return environmentalRisk;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private boolean hospitalData;
        private int hospitalEvents;
        private int uniqueSymptoms;
        private Map<String, Integer> topSymptoms = new LinkedHashMap<>();
        private boolean socialData;
        private int socialMentions;
        private int uniqueKeywords;
        private Map<String, Integer> topKeywords = new LinkedHashMap<>();
        private EnvironmentReading environment;
        private Map<String, Double> modelScores = new LinkedHashMap<>();
        private List<String> correlations = new ArrayList<>();
        private EnvironmentalRiskAssessment environmentalRisk;

        private Builder() {
        }

        public Builder hospital(int totalEvents, int uniqueSymptoms, Map<String, Integer> topSymptoms) {
            this.hospitalData = true;
            this.hospitalEvents = totalEvents;
            this.uniqueSymptoms = uniqueSymptoms;
            this.topSymptoms = new LinkedHashMap<>(topSymptoms);
            return this;
        }

        public Builder social(int totalMentions, int uniqueKeywords, Map<String, Integer> topKeywords) {
            this.socialData = true;
            this.socialMentions = totalMentions;
            this.uniqueKeywords = uniqueKeywords;
            this.topKeywords = new LinkedHashMap<>(topKeywords);
            return this;
        }

        public Builder environment(EnvironmentReading environment) {
            this.environment = environment;
            return this;
        }

        public Builder modelScore(String detector, double normalized) {
            this.modelScores.put(detector, normalized);
            return this;
        }

        public Builder correlation(String correlation) {
            this.correlations.add(correlation);
            return this;
        }

        public Builder environmentalRisk(EnvironmentalRiskAssessment environmentalRisk) {
            this.environmentalRisk = environmentalRisk;
            return this;
        }

        public EvidenceBundle build() {
            return new EvidenceBundle(this);
        }
    }

    @Override
    public String toString() {
        return "EvidenceBundle{hospital=" + (hospitalData ? hospitalEvents : "-")
                + ", social=" + (socialData ? socialMentions : "-")
                + ", correlations=" + correlations + '}';
    }
}
