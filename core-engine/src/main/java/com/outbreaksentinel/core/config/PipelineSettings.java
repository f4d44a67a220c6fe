package com.outbreaksentinel.core.config;

import com.outbreaksentinel.core.model.DetectorId;
import com.outbreaksentinel.core.model.SourceCategory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Every value has a default, so an empty document yields a working pipeline.
 * Expected YAML structure (abridged):
 * </p>
 *
 * <pre>
 * screeningThreshold: 0.5
 * fusion:
 *   weights:
 *     z_score: 0.15
 *     cusum: 0.15
 * verification:
 *   corroborationThreshold: 0.6
 * actions:
 *   - category: medicine
 *     action: Stock antipyretics
 *     target: pharmacy
 *     severities: [high, critical]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link PipelineSettingsLoader}
 * does so automatically.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double screeningThreshold = 0.5;
    private Scoring scoring = new Scoring();
    private Fusion fusion = new Fusion();
    private Integrity integrity = new Integrity();
    private Verification verification = new Verification();
    private Environment environment = new Environment();
    private Escalation escalation = new Escalation();
    private Deferral deferral = new Deferral();
    private Lifecycle lifecycle = new Lifecycle();
    private List<ActionRule> actions = new ArrayList<>();
    private List<RecipientRule> recipients = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if anything is invalid.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requireUnit(errors, "screeningThreshold", screeningThreshold);
        scoring.validate(errors);
        fusion.validate(errors);
        integrity.validate(errors);
        verification.validate(errors);
        environment.validate(errors);
        escalation.validate(errors);
        if (deferral.maxCycles < 0) {
            errors.add("deferral.maxCycles must be >= 0, got: " + deferral.maxCycles);
        }
        lifecycle.validate(errors);

        for (int i = 0; i < actions.size(); i++) {
            ActionRule rule = Objects.requireNonNull(actions.get(i), "Action rule at index " + i + " is null");
            errors.addAll(rule.validate());
        }
        for (int i = 0; i < recipients.size(); i++) {
            RecipientRule rule = Objects.requireNonNull(recipients.get(i), "Recipient at index " + i + " is null");
            errors.addAll(rule.validate());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    static void requireUnit(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            errors.add(name + " must be in [0,1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Baseline lookback and per-detector warm-up. */
    public static class Scoring implements Serializable {
        private static final long serialVersionUID = 1L;

        private int lookbackDays = 14;
        private int zscoreMinHistory = 5;
        private int cusumMinHistory = 5;
        private int ewmaMinHistory = 3;
        private double ewmaAlpha = 0.3;
        private double cusumSlack = 0.5;
        private int lstmMinHistory = 5;

        void validate(List<String> errors) {
            if (lookbackDays < 1) {
                errors.add("scoring.lookbackDays must be >= 1, got: " + lookbackDays);
            }
            if (zscoreMinHistory < 2 || cusumMinHistory < 2 || ewmaMinHistory < 2) {
                errors.add("scoring min-history values must be >= 2");
            }
            if (ewmaAlpha <= 0.0 || ewmaAlpha > 1.0) {
                errors.add("scoring.ewmaAlpha must be in (0,1], got: " + ewmaAlpha);
            }
            if (cusumSlack < 0.0) {
                errors.add("scoring.cusumSlack must be >= 0, got: " + cusumSlack);
            }
        }

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public int getZscoreMinHistory() {
            return zscoreMinHistory;
        }

        public void setZscoreMinHistory(int zscoreMinHistory) {
            this.zscoreMinHistory = zscoreMinHistory;
        }

        public int getCusumMinHistory() {
            return cusumMinHistory;
        }

        public void setCusumMinHistory(int cusumMinHistory) {
            this.cusumMinHistory = cusumMinHistory;
        }

        public int getEwmaMinHistory() {
            return ewmaMinHistory;
        }

        public void setEwmaMinHistory(int ewmaMinHistory) {
            this.ewmaMinHistory = ewmaMinHistory;
        }

        public double getEwmaAlpha() {
            return ewmaAlpha;
        }

        public void setEwmaAlpha(double ewmaAlpha) {
            this.ewmaAlpha = ewmaAlpha;
        }

        public double getCusumSlack() {
            return cusumSlack;
        }

        public void setCusumSlack(double cusumSlack) {
            this.cusumSlack = cusumSlack;
        }

        public int getLstmMinHistory() {
            return lstmMinHistory;
        }

        public void setLstmMinHistory(int lstmMinHistory) {
            this.lstmMinHistory = lstmMinHistory;
        }
    }

    /** Nominal detector weights and the categories confidence is judged against. */
    public static class Fusion implements Serializable {
        private static final long serialVersionUID = 1L;

        private Map<String, Number> weights = defaultWeights();
        private List<String> requiredCategories = new ArrayList<>(List.of("hospital", "social", "environment"));

        private static Map<String, Number> defaultWeights() {
            Map<String, Number> w = new LinkedHashMap<>();
            w.put("z_score", 0.15);
            w.put("cusum", 0.15);
            w.put("ewma", 0.10);
            w.put("lstm_autoencoder", 0.25);
            w.put("isolation_forest", 0.20);
            w.put("prophet_residual", 0.15);
            return w;
        }

        void validate(List<String> errors) {
            if (weights.isEmpty()) {
                errors.add("fusion.weights must name at least one detector");
                return;
            }
            double sum = 0.0;
            for (Map.Entry<String, Number> e : weights.entrySet()) {
                double w = e.getValue() == null ? Double.NaN : e.getValue().doubleValue();
                if (Double.isNaN(w) || w < 0.0) {
                    errors.add("fusion.weights." + e.getKey() + " must be >= 0, got: " + e.getValue());
                }
                sum += w;
            }
            if (Math.abs(sum - 1.0) > 1e-6) {
                errors.add("fusion.weights must sum to 1, got: " + sum);
            }
            if (requiredCategories.isEmpty()) {
                errors.add("fusion.requiredCategories must not be empty");
            }
            for (String c : requiredCategories) {
                try {
                    SourceCategory.fromKey(c);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        /**
         * @return nominal weight per detector, in configuration order
         */
        public Map<DetectorId, Double> nominalWeights() {
            Map<DetectorId, Double> out = new LinkedHashMap<>();
            weights.forEach((name, w) -> out.put(DetectorId.of(name), w.doubleValue()));
            return out;
        }

        public List<SourceCategory> requiredSourceCategories() {
            return requiredCategories.stream().map(SourceCategory::fromKey).toList();
        }

        public Map<String, Number> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Number> weights) {
            this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
        }

        public List<String> getRequiredCategories() {
            return requiredCategories;
        }

        public void setRequiredCategories(List<String> requiredCategories) {
            this.requiredCategories = requiredCategories != null
                    ? new ArrayList<>(requiredCategories)
                    : new ArrayList<>();
        }
    }

    /** Data-integrity stage thresholds. */
    public static class Integrity implements Serializable {
        private static final long serialVersionUID = 1L;

        private int minValidDetectors = 2;
        private int minSampleSize = 5;
        private double maxVectorIndex = 10.0;

        void validate(List<String> errors) {
            if (minValidDetectors < 1) {
                errors.add("integrity.minValidDetectors must be >= 1, got: " + minValidDetectors);
            }
            if (minSampleSize < 0) {
                errors.add("integrity.minSampleSize must be >= 0, got: " + minSampleSize);
            }
        }

        public int getMinValidDetectors() {
            return minValidDetectors;
        }

        public void setMinValidDetectors(int minValidDetectors) {
            this.minValidDetectors = minValidDetectors;
        }

        public int getMinSampleSize() {
            return minSampleSize;
        }

        public void setMinSampleSize(int minSampleSize) {
            this.minSampleSize = minSampleSize;
        }

        public double getMaxVectorIndex() {
            return maxVectorIndex;
        }

        public void setMaxVectorIndex(double maxVectorIndex) {
            this.maxVectorIndex = maxVectorIndex;
        }
    }

    /** Cross-source verification thresholds. */
    public static class Verification implements Serializable {
        private static final long serialVersionUID = 1L;

        private double corroborationThreshold = 0.6;
        private int minCorroboratingSources = 2;
        private double singleSourceOverride = 0.9;

        void validate(List<String> errors) {
            requireUnit(errors, "verification.corroborationThreshold", corroborationThreshold);
            requireUnit(errors, "verification.singleSourceOverride", singleSourceOverride);
            if (minCorroboratingSources < 1 || minCorroboratingSources > SourceCategory.values().length) {
                errors.add("verification.minCorroboratingSources must be in [1,3], got: "
                        + minCorroboratingSources);
            }
        }

        public double getCorroborationThreshold() {
            return corroborationThreshold;
        }

        public void setCorroborationThreshold(double corroborationThreshold) {
            this.corroborationThreshold = corroborationThreshold;
        }

        public int getMinCorroboratingSources() {
            return minCorroboratingSources;
        }

        public void setMinCorroboratingSources(int minCorroboratingSources) {
            this.minCorroboratingSources = minCorroboratingSources;
        }

        public double getSingleSourceOverride() {
            return singleSourceOverride;
        }

        public void setSingleSourceOverride(double singleSourceOverride) {
            this.singleSourceOverride = singleSourceOverride;
        }
    }

    /**
     * Environmental-risk stage. In {@code advisory} mode (default) the stage
     * never suppresses; in {@code enforcing} mode it suppresses when
     * environment data is present and its risk score is at most
     * {@code contradictionMaxRisk}.
     */
    public static class Environment implements Serializable {
        private static final long serialVersionUID = 1L;

        public static final String ADVISORY = "advisory";
        public static final String ENFORCING = "enforcing";

        private String mode = ADVISORY;
        private double contradictionMaxRisk = 1.0;
        private boolean upgradeOnHighRisk = true;
        private boolean downgradeOnLowRisk = false;

        void validate(List<String> errors) {
            if (!ADVISORY.equals(mode) && !ENFORCING.equals(mode)) {
                errors.add("environment.mode must be 'advisory' or 'enforcing', got: '" + mode + "'");
            }
            if (contradictionMaxRisk < 0.0 || contradictionMaxRisk > 10.0) {
                errors.add("environment.contradictionMaxRisk must be in [0,10], got: " + contradictionMaxRisk);
            }
        }

        public boolean isEnforcing() {
            return ENFORCING.equals(mode);
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode != null ? mode.toLowerCase(Locale.ROOT) : null;
        }

        public double getContradictionMaxRisk() {
            return contradictionMaxRisk;
        }

        public void setContradictionMaxRisk(double contradictionMaxRisk) {
            this.contradictionMaxRisk = contradictionMaxRisk;
        }

        public boolean isUpgradeOnHighRisk() {
            return upgradeOnHighRisk;
        }

        public void setUpgradeOnHighRisk(boolean upgradeOnHighRisk) {
            this.upgradeOnHighRisk = upgradeOnHighRisk;
        }

        public boolean isDowngradeOnLowRisk() {
            return downgradeOnLowRisk;
        }

        public void setDowngradeOnLowRisk(boolean downgradeOnLowRisk) {
            this.downgradeOnLowRisk = downgradeOnLowRisk;
        }
    }

    /**
     * Severity threshold table, the confidence floor below which an otherwise
     * verified case is suppressed, and the narrative timeout.
     */
    public static class Escalation implements Serializable {
        private static final long serialVersionUID = 1L;

        private double criticalScore = 0.85;
        private double criticalConfidence = 0.75;
        private double highScore = 0.65;
        private double highConfidence = 0.5;
        private double mediumScore = 0.45;
        private double mediumConfidence = 0.3;
        private double minConfidence = 0.2;
        private long narrativeTimeoutMs = 3_000;

        void validate(List<String> errors) {
            requireUnit(errors, "escalation.minConfidence", minConfidence);
            requireUnit(errors, "escalation.criticalScore", criticalScore);
            requireUnit(errors, "escalation.criticalConfidence", criticalConfidence);
            requireUnit(errors, "escalation.highScore", highScore);
            requireUnit(errors, "escalation.highConfidence", highConfidence);
            requireUnit(errors, "escalation.mediumScore", mediumScore);
            requireUnit(errors, "escalation.mediumConfidence", mediumConfidence);
            if (!(criticalScore >= highScore && highScore >= mediumScore)) {
                errors.add("escalation score thresholds must be ordered critical >= high >= medium");
            }
            if (narrativeTimeoutMs < 1) {
                errors.add("escalation.narrativeTimeoutMs must be >= 1, got: " + narrativeTimeoutMs);
            }
        }

        public double getCriticalScore() {
            return criticalScore;
        }

        public void setCriticalScore(double criticalScore) {
            this.criticalScore = criticalScore;
        }

        public double getCriticalConfidence() {
            return criticalConfidence;
        }

        public void setCriticalConfidence(double criticalConfidence) {
            this.criticalConfidence = criticalConfidence;
        }

        public double getHighScore() {
            return highScore;
        }

        public void setHighScore(double highScore) {
            this.highScore = highScore;
        }

        public double getHighConfidence() {
            return highConfidence;
        }

        public void setHighConfidence(double highConfidence) {
            this.highConfidence = highConfidence;
        }

        public double getMediumScore() {
            return mediumScore;
        }

        public void setMediumScore(double mediumScore) {
            this.mediumScore = mediumScore;
        }

        public double getMediumConfidence() {
            return mediumConfidence;
        }

        public void setMediumConfidence(double mediumConfidence) {
            this.mediumConfidence = mediumConfidence;
        }

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public long getNarrativeTimeoutMs() {
            return narrativeTimeoutMs;
        }

        public void setNarrativeTimeoutMs(long narrativeTimeoutMs) {
            this.narrativeTimeoutMs = narrativeTimeoutMs;
        }
    }

    /** Bound on how often a case may be deferred before it is suppressed. */
    public static class Deferral implements Serializable {
        private static final long serialVersionUID = 1L;

        private int maxCycles = 3;

        public int getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
        }
    }

    /** Alert deduplication window and persistence retry policy. */
    public static class Lifecycle implements Serializable {
        private static final long serialVersionUID = 1L;

        private int dedupWindowDays = 1;
        private int maxPersistAttempts = 3;
        private long initialBackoffMs = 100;
        private double backoffMultiplier = 2.0;

        void validate(List<String> errors) {
            if (dedupWindowDays < 0) {
                errors.add("lifecycle.dedupWindowDays must be >= 0, got: " + dedupWindowDays);
            }
            if (maxPersistAttempts < 1) {
                errors.add("lifecycle.maxPersistAttempts must be >= 1, got: " + maxPersistAttempts);
            }
            if (initialBackoffMs < 0 || backoffMultiplier < 1.0) {
                errors.add("lifecycle backoff must be non-negative and non-shrinking");
            }
        }

        public int getDedupWindowDays() {
            return dedupWindowDays;
        }

        public void setDedupWindowDays(int dedupWindowDays) {
            this.dedupWindowDays = dedupWindowDays;
        }

        public int getMaxPersistAttempts() {
            return maxPersistAttempts;
        }

        public void setMaxPersistAttempts(int maxPersistAttempts) {
            this.maxPersistAttempts = maxPersistAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public double getScreeningThreshold() {
        return screeningThreshold;
    }

    public void setScreeningThreshold(double screeningThreshold) {
        this.screeningThreshold = screeningThreshold;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring != null ? scoring : new Scoring();
    }

    public Fusion getFusion() {
        return fusion;
    }

    public void setFusion(Fusion fusion) {
        this.fusion = fusion != null ? fusion : new Fusion();
    }

    public Integrity getIntegrity() {
        return integrity;
    }

    public void setIntegrity(Integrity integrity) {
        this.integrity = integrity != null ? integrity : new Integrity();
    }

    public Verification getVerification() {
        return verification;
    }

    public void setVerification(Verification verification) {
        this.verification = verification != null ? verification : new Verification();
    }

    public Environment getEnvironment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment != null ? environment : new Environment();
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public void setEscalation(Escalation escalation) {
        this.escalation = escalation != null ? escalation : new Escalation();
    }

    public Deferral getDeferral() {
        return deferral;
    }

    public void setDeferral(Deferral deferral) {
        this.deferral = deferral != null ? deferral : new Deferral();
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(Lifecycle lifecycle) {
        this.lifecycle = lifecycle != null ? lifecycle : new Lifecycle();
    }

    /**
     * @return unmodifiable recommended-action rule table
     */
    public List<ActionRule> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public void setActions(List<ActionRule> actions) {
        this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
    }

    /**
     * @return unmodifiable recipient directory entries
     */
    public List<RecipientRule> getRecipients() {
        return Collections.unmodifiableList(recipients);
    }

    public void setRecipients(List<RecipientRule> recipients) {
        this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PipelineSettings{" +
                "screeningThreshold=" + screeningThreshold +
                ", weights=" + fusion.weights +
                ", actions=" + actions.size() +
                ", recipients=" + recipients.size() +
                ", environmentMode=" + environment.mode +
                '}';
    }
}
