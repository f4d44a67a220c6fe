package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.alert.AlertLifecycleManager;
import com.outbreaksentinel.core.alert.InMemoryAlertStore;
import com.outbreaksentinel.core.alert.MaterializationResult;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.outbreaksentinel.core.TestCases.escalated;
import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.notify.RecipientDirectoryTest.rule;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationDispatcher}.
 */
class NotificationDispatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T06:00:00Z"), ZoneOffset.UTC);

    private AlertLifecycleManager lifecycle;
    private RecordingChannel webhook;

    @BeforeEach
    void setUp() {
        lifecycle = new AlertLifecycleManager(new InMemoryAlertStore(), CLOCK, new PipelineSettings.Lifecycle(),
                d -> { });
        webhook = new RecordingChannel("webhook");
    }

    private NotificationDispatcher dispatcher(RecipientDirectory directory, NotificationChannel... channels) {
        return new NotificationDispatcher(List.of(channels), directory, lifecycle, CLOCK);
    }

    private static RecipientDirectory district7Webhook() {
        return new RecipientDirectory(List.of(
                rule("*", "log", "health-ops"),
                rule("district-7", "webhook", "http://localhost/hook")));
    }

    private MaterializationResult created() {
        return lifecycle.materialize(escalated("run-1", "district-7", TODAY, Severity.HIGH, 0.72));
    }

    @Test
    @DisplayName("Should send a new alert to every recipient and mark it notified")
    void notifiesNewAlert() {
        MaterializationResult result = created();

        Optional<DispatchOutcome> outcome = dispatcher(district7Webhook(), webhook, new LoggingNotificationChannel())
                .onMaterialized(result);

        assertThat(outcome).isPresent();
        assertThat(outcome.get().isMarkedNotified()).isTrue();
        assertThat(webhook.requests).hasSize(1);
        NotificationRequest sent = webhook.requests.get(0);
        assertThat(sent.getSubject()).isEqualTo("[HIGH] Disease Outbreak Alert - district-7");
        assertThat(sent.getChannelPreferences()).containsExactly("webhook");
        assertThat(sent.getRequestedAt()).isEqualTo(CLOCK.instant());
        assertThat(lifecycle.find(result.getAlert().getAlertId())).get()
                .extracting(Alert::isNotified).isEqualTo(true);
    }

    @Test
    @DisplayName("Should skip merges that did not raise severity")
    void skipsPlainMerge() {
        created();
        MaterializationResult merged = lifecycle.materialize(
                escalated("run-2", "district-7", TODAY.plusDays(1), Severity.HIGH, 0.75));

        Optional<DispatchOutcome> outcome = dispatcher(district7Webhook(), webhook).onMaterialized(merged);

        assertThat(outcome).isEmpty();
        assertThat(webhook.requests).isEmpty();
    }

    @Test
    @DisplayName("Should leave the alert un-notified when a delivery fails transiently")
    void transientFailureKeepsUnnotified() {
        MaterializationResult result = created();
        webhook.next = DeliveryResult.Status.TRANSIENT;

        DispatchOutcome outcome = dispatcher(district7Webhook(), webhook).dispatch(result.getAlert());

        assertThat(outcome.isMarkedNotified()).isFalse();
        assertThat(outcome.count(DeliveryResult.Status.TRANSIENT)).isEqualTo(1);
        assertThat(lifecycle.find(result.getAlert().getAlertId())).get()
                .extracting(Alert::isNotified).isEqualTo(false);
    }

    @Test
    @DisplayName("Should count permanent rejections as definitive")
    void rejectionIsDefinitive() {
        MaterializationResult result = created();
        webhook.next = DeliveryResult.Status.REJECTED;

        DispatchOutcome outcome = dispatcher(district7Webhook(), webhook).dispatch(result.getAlert());

        assertThat(outcome.isMarkedNotified()).isTrue();
        assertThat(outcome.count(DeliveryResult.Status.REJECTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject deliveries to channels that are not enabled")
    void disabledChannel() {
        MaterializationResult result = created();

        DispatchOutcome outcome = dispatcher(district7Webhook(), new LoggingNotificationChannel())
                .dispatch(result.getAlert());

        assertThat(outcome.getResults()).singleElement()
                .satisfies(r -> assertThat(r.getDetail()).isEqualTo("channel 'webhook' not enabled"));
        assertThat(outcome.isMarkedNotified()).isTrue();
    }

    @Test
    @DisplayName("Should turn a channel exception into a transient failure")
    void channelExceptionIsTransient() {
        MaterializationResult result = created();
        webhook.fail = true;

        DispatchOutcome outcome = dispatcher(district7Webhook(), webhook).dispatch(result.getAlert());

        assertThat(outcome.count(DeliveryResult.Status.TRANSIENT)).isEqualTo(1);
        assertThat(outcome.isMarkedNotified()).isFalse();
    }

    @Test
    @DisplayName("Should not mark notified when no recipient is configured")
    void noRecipients() {
        MaterializationResult result = created();

        DispatchOutcome outcome = dispatcher(new RecipientDirectory(List.of()), webhook).dispatch(result.getAlert());

        assertThat(outcome.getResults()).isEmpty();
        assertThat(outcome.isMarkedNotified()).isFalse();
    }

    private static final class RecordingChannel implements NotificationChannel {

        private final String name;
        private final List<NotificationRequest> requests = new ArrayList<>();
        private DeliveryResult.Status next = DeliveryResult.Status.SENT;
        private boolean fail;

        private RecordingChannel(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public DeliveryResult deliver(NotificationRequest request, Recipient recipient) {
            if (fail) {
                throw new IllegalStateException("connection reset");
            }
            requests.add(request);
            return switch (next) {
                case SENT -> DeliveryResult.sent(recipient);
                case REJECTED -> DeliveryResult.rejected(recipient, "HTTP 410");
                case TRANSIENT -> DeliveryResult.transientFailure(recipient, "HTTP 503");
            };
        }
    }
}
