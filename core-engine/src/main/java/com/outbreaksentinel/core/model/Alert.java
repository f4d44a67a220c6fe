package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted, user-facing record of an escalated case.
 *
 * <p>
 * An alert covers a window of day buckets for one location
 * ({@code windowStart}..{@code windowEnd}); evidence from later cells that
 * fall inside (or adjacent to) that window is merged into the same alert
 * instead of creating a duplicate.
 * </p>
 *
 * <h3>Snapshots</h3>
 * <p>
 * {@code evidence} and {@code metadata} are deep-copied on the way in and
 * exposed read-only, so later changes to source data never alter alert
 * history retroactively.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertId}, {@code location},
 * {@code timeBucket} and {@code createdAt} are required; omitting any of
 * them throws {@link NullPointerException} at build time. The no-arg
 * constructor and setters exist for Jackson only.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String alertId;
    private String runId;
    private String fusionResultId;
    private String location;
    private LocalDate timeBucket;
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private Instant createdAt;
    private Instant updatedAt;
    private double anomalyScore;
    private double confidence;
    private Severity severity = Severity.LOW;
    private Map<String, Object> evidence = new LinkedHashMap<>();
    private List<RecommendedAction> recommendedActions = new ArrayList<>();
    private AlertStatus status = AlertStatus.ACTIVE;
    private boolean notified;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Optimistic-concurrency version, bumped by the store on every write. */
    private long version;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.location = Objects.requireNonNull(builder.location, "location must not be null");
        this.timeBucket = Objects.requireNonNull(builder.timeBucket, "timeBucket must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.runId = builder.runId;
        this.fusionResultId = builder.fusionResultId;
        this.windowStart = builder.windowStart != null ? builder.windowStart : builder.timeBucket;
        this.windowEnd = builder.windowEnd != null ? builder.windowEnd : builder.timeBucket;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.anomalyScore = builder.anomalyScore;
        this.confidence = builder.confidence;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.evidence = deepCopy(builder.evidence);
        this.recommendedActions = copyActions(builder.recommendedActions);
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.notified = builder.notified;
        this.metadata = deepCopy(builder.metadata);
        this.version = builder.version;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder holding a copy of every field of this alert
     */
    public Builder toBuilder() {
        return new Builder()
                .alertId(alertId)
                .runId(runId)
                .fusionResultId(fusionResultId)
                .location(location)
                .timeBucket(timeBucket)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .anomalyScore(anomalyScore)
                .confidence(confidence)
                .severity(severity)
                .evidence(evidence)
                .recommendedActions(recommendedActions)
                .status(status)
                .notified(notified)
                .metadata(metadata)
                .version(version);
    }

    /**
     * @return an independent deep copy of this alert
     */
    public Alert copy() {
        return toBuilder().build();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String alertId;
        private String runId;
        private String fusionResultId;
        private String location;
        private LocalDate timeBucket;
        private LocalDate windowStart;
        private LocalDate windowEnd;
        private Instant createdAt;
        private Instant updatedAt;
        private double anomalyScore;
        private double confidence;
        private Severity severity = Severity.LOW;
        private Map<String, Object> evidence;
        private List<RecommendedAction> recommendedActions;
        private AlertStatus status = AlertStatus.ACTIVE;
        private boolean notified;
        private Map<String, Object> metadata;
        private long version;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder fusionResultId(String fusionResultId) {
            this.fusionResultId = fusionResultId;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder timeBucket(LocalDate timeBucket) {
            this.timeBucket = timeBucket;
            return this;
        }

        public Builder windowStart(LocalDate windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(LocalDate windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder recommendedActions(List<RecommendedAction> recommendedActions) {
            this.recommendedActions = recommendedActions;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder notified(boolean notified) {
            this.notified = notified;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Window
    // ---------------------------------------------------------------

    /**
     * Whether a cell for {@code bucket} belongs to this alert's window,
     * allowing {@code slackDays} on either side.
     *
     * @param bucket    day bucket of the incoming cell
     * @param slackDays days of tolerance around the window
     * @return {@code true} if the bucket overlaps the widened window
     */
    public boolean overlaps(LocalDate bucket, int slackDays) {
        return !bucket.isBefore(windowStart.minusDays(slackDays))
                && !bucket.isAfter(windowEnd.plusDays(slackDays));
    }

    @JsonIgnore
    public boolean isOpen() {
        return status.isOpen();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getAlertId() {
        return alertId;
    }

    public void setAlertId(String alertId) {
        this.alertId = alertId;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getFusionResultId() {
        return fusionResultId;
    }

    public void setFusionResultId(String fusionResultId) {
        this.fusionResultId = fusionResultId;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public LocalDate getTimeBucket() {
        return timeBucket;
    }

    public void setTimeBucket(LocalDate timeBucket) {
        this.timeBucket = timeBucket;
    }

    public LocalDate getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(LocalDate windowStart) {
        this.windowStart = windowStart;
    }

    public LocalDate getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(LocalDate windowEnd) {
        this.windowEnd = windowEnd;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public void setAnomalyScore(double anomalyScore) {
        this.anomalyScore = anomalyScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    /**
     * @return unmodifiable view of the evidence snapshot
     */
    public Map<String, Object> getEvidence() {
        return Collections.unmodifiableMap(evidence);
    }

    public void setEvidence(Map<String, Object> evidence) {
        this.evidence = deepCopy(evidence);
    }

    /**
     * @return unmodifiable list of recommended actions
     */
    public List<RecommendedAction> getRecommendedActions() {
        return Collections.unmodifiableList(recommendedActions);
    }

    public void setRecommendedActions(List<RecommendedAction> recommendedActions) {
        this.recommendedActions = copyActions(recommendedActions);
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public boolean isNotified() {
        return notified;
    }

    public void setNotified(boolean notified) {
        this.notified = notified;
    }

    /**
     * @return unmodifiable view of the free-form metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = deepCopy(metadata);
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    // ---------------------------------------------------------------
    // Snapshot helpers
    // ---------------------------------------------------------------

    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, deepCopyValue(v)));
        }
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopyValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopyValue(v)));
            return copy;
        }
        return value;
    }

    private static List<RecommendedAction> copyActions(List<RecommendedAction> source) {
        List<RecommendedAction> copy = new ArrayList<>();
        if (source != null) {
            for (RecommendedAction a : source) {
                copy.add(new RecommendedAction(a.getCategory(), a.getAction(), a.getPriority(),
                        a.getTarget(), a.getDetails()));
            }
        }
        return copy;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(alertId, alert.alertId) && version == alert.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, version);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", location='" + location + '\'' +
                ", window=" + windowStart + ".." + windowEnd +
                ", severity=" + severity +
                ", status=" + status +
                ", notified=" + notified +
                ", version=" + version +
                '}';
    }
}
