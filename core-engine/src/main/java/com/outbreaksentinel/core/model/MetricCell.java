package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One (location, day) observation unit produced by the external aggregation
 * stage.
 *
 * <p>
 * A cell carries the per-source raw counts, the environmental reading, any
 * raw outputs the external model services attached, and the provenance flags
 * that mark which source categories actually delivered data for the day.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Instances are immutable once built. All maps and sets are copied on
 * construction and exposed as unmodifiable views.
 * </p>
 *
 * <p>
 * Counts are <strong>not</strong> range-checked here: a malformed aggregate
 * must still be representable so that scorers can mark it invalid and the
 * integrity stage can record why it was rejected.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = MetricCell.Builder.class)
public final class MetricCell implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String location;
    private final LocalDate timeBucket;
    private final int hospitalEvents;
    private final Map<String, Integer> symptomCounts;
    private final int socialMentions;
    private final Map<String, Integer> keywordCounts;
    private final EnvironmentReading environment;
    private final Map<String, Double> modelOutputs;
    private final Set<SourceCategory> sources;

    private MetricCell(Builder b) {
        this.location = Objects.requireNonNull(b.location, "location must not be null");
        this.timeBucket = Objects.requireNonNull(b.timeBucket, "timeBucket must not be null");
        if (location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
        this.hospitalEvents = b.hospitalEvents;
        this.symptomCounts = Collections.unmodifiableMap(new LinkedHashMap<>(b.symptomCounts));
        this.socialMentions = b.socialMentions;
        this.keywordCounts = Collections.unmodifiableMap(new LinkedHashMap<>(b.keywordCounts));
        this.environment = b.environment;
        this.modelOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.modelOutputs));
        this.sources = b.sources.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(SourceCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(b.sources));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this cell's values
     */
    public Builder toBuilder() {
        return new Builder()
                .location(location)
                .timeBucket(timeBucket)
                .hospitalEvents(hospitalEvents)
                .symptomCounts(symptomCounts)
                .socialMentions(socialMentions)
                .keywordCounts(keywordCounts)
                .environment(environment)
                .modelOutputs(modelOutputs)
                .sources(sources);
    }

    // ---------------------------------------------------------------
    // Derived accessors
    // ---------------------------------------------------------------

    @JsonIgnore
    public CellKey getKey() {
        return new CellKey(location, timeBucket);
    }

    /**
     * @param category source category
     * @return {@code true} if the provenance flags mark the category as present
     */
    public boolean hasSource(SourceCategory category) {
        return sources.contains(category);
    }

    /**
     * Combined human-signal volume (hospital events plus social mentions),
     * the series the statistical detectors run on.
     *
     * @return total event volume for the day
     */
    @JsonIgnore
    public long getTotalEvents() {
        return (long) hospitalEvents + socialMentions;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getLocation() {
        return location;
    }

    public LocalDate getTimeBucket() {
        return timeBucket;
    }

    public int getHospitalEvents() {
        return hospitalEvents;
    }

    public Map<String, Integer> getSymptomCounts() {
        return symptomCounts;
    }

    public int getSocialMentions() {
        return socialMentions;
    }

    public Map<String, Integer> getKeywordCounts() {
        return keywordCounts;
    }

    /**
     * @return environmental reading, or {@code null} if none was aggregated
     */
    public EnvironmentReading getEnvironment() {
        return environment;
    }

    /**
     * Raw outputs attached by external model services, keyed by detector name.
     *
     * @return unmodifiable map of detector name to raw model output
     */
    public Map<String, Double> getModelOutputs() {
        return modelOutputs;
    }

    public Set<SourceCategory> getSources() {
        return sources;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, also used by Jackson when reading JSON-lines input.
     * {@code location} and {@code timeBucket} are required.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String location;
        private LocalDate timeBucket;
        private int hospitalEvents;
        private Map<String, Integer> symptomCounts = new LinkedHashMap<>();
        private int socialMentions;
        private Map<String, Integer> keywordCounts = new LinkedHashMap<>();
        private EnvironmentReading environment;
        private Map<String, Double> modelOutputs = new LinkedHashMap<>();
        private Set<SourceCategory> sources = EnumSet.noneOf(SourceCategory.class);

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder timeBucket(LocalDate timeBucket) {
            this.timeBucket = timeBucket;
            return this;
        }

        public Builder hospitalEvents(int hospitalEvents) {
            this.hospitalEvents = hospitalEvents;
            return this;
        }

        public Builder symptomCounts(Map<String, Integer> symptomCounts) {
            this.symptomCounts = symptomCounts != null ? new LinkedHashMap<>(symptomCounts) : new LinkedHashMap<>();
            return this;
        }

        public Builder socialMentions(int socialMentions) {
            this.socialMentions = socialMentions;
            return this;
        }

        public Builder keywordCounts(Map<String, Integer> keywordCounts) {
            this.keywordCounts = keywordCounts != null ? new LinkedHashMap<>(keywordCounts) : new LinkedHashMap<>();
            return this;
        }

        public Builder environment(EnvironmentReading environment) {
            this.environment = environment;
            return this;
        }

        public Builder modelOutputs(Map<String, Double> modelOutputs) {
            this.modelOutputs = modelOutputs != null ? new LinkedHashMap<>(modelOutputs) : new LinkedHashMap<>();
            return this;
        }

        public Builder modelOutput(String detector, double rawOutput) {
            this.modelOutputs.put(detector, rawOutput);
            return this;
        }

        public Builder sources(Collection<SourceCategory> sources) {
            this.sources = (sources == null || sources.isEmpty())
                    ? EnumSet.noneOf(SourceCategory.class)
                    : EnumSet.copyOf(sources);
            return this;
        }

        public Builder source(SourceCategory source) {
            this.sources.add(source);
            return this;
        }

        /**
         * @return a new immutable {@link MetricCell}
         * @throws NullPointerException     if location or timeBucket is missing
         * @throws IllegalArgumentException if location is blank
         */
        public MetricCell build() {
            return new MetricCell(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricCell that))
            return false;
        return hospitalEvents == that.hospitalEvents
                && socialMentions == that.socialMentions
                && location.equals(that.location)
                && timeBucket.equals(that.timeBucket)
                && symptomCounts.equals(that.symptomCounts)
                && keywordCounts.equals(that.keywordCounts)
                && Objects.equals(environment, that.environment)
                && modelOutputs.equals(that.modelOutputs)
                && sources.equals(that.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, timeBucket, hospitalEvents, socialMentions,
                symptomCounts, keywordCounts, environment, modelOutputs, sources);
    }

    @Override
    public String toString() {
        return "MetricCell{" +
                "location='" + location + '\'' +
                ", timeBucket=" + timeBucket +
                ", hospitalEvents=" + hospitalEvents +
                ", socialMentions=" + socialMentions +
                ", environment=" + environment +
                ", sources=" + sources +
                '}';
    }
}
