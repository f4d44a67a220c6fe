package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Message handed to the notification channels for one alert.
 *
 * <p>
 * Emitted for every newly created alert and for every merge that raised an
 * alert's severity. Serialized as-is to webhook bodies and Kafka records.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    private String alertId;
    private String location;
    private Severity severity;
    private double anomalyScore;
    private double confidence;
    private String subject;
    private String body;
    private List<Recipient> recipients = new ArrayList<>();
    private List<String> channelPreferences = new ArrayList<>();
    private List<RecommendedAction> recommendedActions = new ArrayList<>();
    private Instant requestedAt;

    /** No-arg constructor required by Jackson. */
    public NotificationRequest() {
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

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
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

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public List<Recipient> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<Recipient> recipients) {
        this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    }

    public List<String> getChannelPreferences() {
        return channelPreferences;
    }

    public void setChannelPreferences(List<String> channelPreferences) {
        this.channelPreferences = channelPreferences != null ? new ArrayList<>(channelPreferences) : new ArrayList<>();
    }

    public List<RecommendedAction> getRecommendedActions() {
        return recommendedActions;
    }

    public void setRecommendedActions(List<RecommendedAction> recommendedActions) {
        this.recommendedActions = recommendedActions != null ? new ArrayList<>(recommendedActions) : new ArrayList<>();
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public void setRequestedAt(Instant requestedAt) {
        this.requestedAt = requestedAt;
    }

    @Override
    public String toString() {
        return "NotificationRequest{alertId='" + alertId + "', location='" + location
                + "', severity=" + severity + ", recipients=" + recipients + '}';
    }
}
