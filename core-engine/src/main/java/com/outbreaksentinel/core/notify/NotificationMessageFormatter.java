package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.RecommendedAction;

import java.util.Locale;
import java.util.Map;

/**
 * Plain-text subject and body for an alert notification.
 */
public final class NotificationMessageFormatter {

    static final int MAX_ACTIONS = 5;

    private static final String NOT_AVAILABLE = "N/A";

    private NotificationMessageFormatter() {
        // utility class — not instantiable
    }

    public static String subject(Alert alert) {
        return "[" + alert.getSeverity().key().toUpperCase(Locale.ROOT) + "] Disease Outbreak Alert - "
                + alert.getLocation();
    }

    public static String body(Alert alert) {
        Map<String, Object> evidence = alert.getEvidence();
        StringBuilder sb = new StringBuilder();
        sb.append("DISEASE OUTBREAK ALERT\n\n");
        sb.append("Severity: ").append(alert.getSeverity().key().toUpperCase(Locale.ROOT)).append('\n');
        sb.append("Location: ").append(alert.getLocation()).append('\n');
        sb.append("Window: ").append(alert.getWindowStart()).append(" .. ").append(alert.getWindowEnd()).append('\n');
        sb.append(String.format(Locale.ROOT, "Confidence: %.1f%%%n", alert.getConfidence() * 100));
        sb.append(String.format(Locale.ROOT, "Anomaly Score: %.3f%n", alert.getAnomalyScore()));
        sb.append("\nEVIDENCE:\n");
        sb.append("- Hospital Events: ").append(lookup(evidence, "hospital", "total_events")).append('\n');
        sb.append("- Social Mentions: ").append(lookup(evidence, "social", "total_mentions")).append('\n');
        sb.append("- Environmental Risk: ").append(environmentalRisk(evidence)).append('\n');
        sb.append("\nRECOMMENDED ACTIONS:");
        alert.getRecommendedActions().stream().limit(MAX_ACTIONS).forEach(a -> sb.append('\n').append(line(a)));
        sb.append("\n\nAlert ID: ").append(alert.getAlertId());
        sb.append("\nUpdated: ").append(alert.getUpdatedAt());
        return sb.toString();
    }

    private static String line(RecommendedAction action) {
        String priority = action.getPriority() != null ? action.getPriority().toUpperCase(Locale.ROOT) : "";
        return "[" + priority + "] " + action.getCategory() + ": " + action.getAction();
    }

    private static Object lookup(Map<String, Object> evidence, String section, String key) {
        if (evidence.get(section) instanceof Map<?, ?> map && map.get(key) != null) {
            return map.get(key);
        }
        return NOT_AVAILABLE;
    }

    private static Object environmentalRisk(Map<String, Object> evidence) {
        if (evidence.get("environment") instanceof Map<?, ?> env
                && env.get("risk_assessment") instanceof Map<?, ?> risk
                && risk.get("risk_score") != null) {
            return risk.get("risk_score");
        }
        return NOT_AVAILABLE;
    }
}
