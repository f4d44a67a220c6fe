package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.AlertStatus;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationMessageFormatter}.
 */
class NotificationMessageFormatterTest {

    private static Alert.Builder alert() {
        return Alert.builder()
                .alertId("abc123")
                .location("district-7")
                .timeBucket(LocalDate.of(2024, 3, 15))
                .windowEnd(LocalDate.of(2024, 3, 16))
                .createdAt(Instant.parse("2024-03-15T06:00:00Z"))
                .anomalyScore(0.7234)
                .confidence(0.625)
                .severity(Severity.HIGH)
                .status(AlertStatus.ACTIVE);
    }

    @Test
    @DisplayName("Should put severity and location in the subject")
    void subject() {
        assertThat(NotificationMessageFormatter.subject(alert().build()))
                .isEqualTo("[HIGH] Disease Outbreak Alert - district-7");
    }

    @Test
    @DisplayName("Should render evidence, scores and actions in the body")
    void body() {
        Alert a = alert()
                .evidence(Map.of(
                        "hospital", Map.of("total_events", 30),
                        "social", Map.of("total_mentions", 45),
                        "environment", Map.of("risk_assessment", Map.of("risk_score", 5))))
                .recommendedActions(List.of(
                        new RecommendedAction("medicine", "Stock antipyretics", "high", "pharmacies", "")))
                .build();

        String body = NotificationMessageFormatter.body(a);

        assertThat(body)
                .startsWith("DISEASE OUTBREAK ALERT")
                .contains("Severity: HIGH")
                .contains("Window: 2024-03-15 .. 2024-03-16")
                .contains("Confidence: 62.5%")
                .contains("Anomaly Score: 0.723")
                .contains("- Hospital Events: 30")
                .contains("- Social Mentions: 45")
                .contains("- Environmental Risk: 5")
                .contains("[HIGH] medicine: Stock antipyretics")
                .contains("Alert ID: abc123");
    }

    @Test
    @DisplayName("Should show N/A for missing evidence and cap the action list")
    void missingEvidenceAndActionCap() {
        List<RecommendedAction> actions = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            actions.add(new RecommendedAction("preparedness", "step " + i, "medium", "all", ""));
        }

        String body = NotificationMessageFormatter.body(alert().recommendedActions(actions).build());

        assertThat(body).contains("- Hospital Events: N/A").contains("- Environmental Risk: N/A");
        assertThat(body).contains("step 4").doesNotContain("step 5");
    }
}
