package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.alert.AlertLifecycleManager;
import com.outbreaksentinel.core.alert.MaterializationResult;
import com.outbreaksentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends alert notifications and reports definitive outcomes back to the
 * lifecycle manager.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>Only created alerts and merges that raised severity are sent.</li>
 * <li>Each recipient gets exactly one delivery attempt per call. Transient
 * failures are returned to the caller, never retried here.</li>
 * <li>{@code notified} is set only when every delivery was definitive
 * (sent or permanently rejected).</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<String, NotificationChannel> channels;
    private final RecipientDirectory directory;
    private final AlertLifecycleManager lifecycle;
    private final Clock clock;

    public NotificationDispatcher(Collection<? extends NotificationChannel> channels, RecipientDirectory directory,
            AlertLifecycleManager lifecycle, Clock clock) {
        Objects.requireNonNull(channels, "channels must not be null");
        this.channels = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.name(), channel);
        }
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Dispatch for a materialization, if it calls for a notification.
     *
     * @return empty when nothing needed sending
     */
    public Optional<DispatchOutcome> onMaterialized(MaterializationResult result) {
        if (!result.requiresNotification()) {
            LOG.debug("No notification for {} ({})", result.getAlert().getAlertId(), result.getKind());
            return Optional.empty();
        }
        return Optional.of(dispatch(result.getAlert()));
    }

    public NotificationRequest buildRequest(Alert alert) {
        List<Recipient> recipients = directory.resolve(alert.getLocation());
        NotificationRequest request = new NotificationRequest();
        request.setAlertId(alert.getAlertId());
        request.setLocation(alert.getLocation());
        request.setSeverity(alert.getSeverity());
        request.setAnomalyScore(alert.getAnomalyScore());
        request.setConfidence(alert.getConfidence());
        request.setSubject(NotificationMessageFormatter.subject(alert));
        request.setBody(NotificationMessageFormatter.body(alert));
        request.setRecipients(recipients);
        request.setChannelPreferences(recipients.stream().map(Recipient::getChannel).distinct().toList());
        request.setRecommendedActions(alert.getRecommendedActions());
        request.setRequestedAt(clock.instant());
        return request;
    }

    public DispatchOutcome dispatch(Alert alert) {
        NotificationRequest request = buildRequest(alert);
        if (request.getRecipients().isEmpty()) {
            LOG.warn("No recipients configured for location '{}', alert {} stays un-notified",
                    alert.getLocation(), alert.getAlertId());
            return new DispatchOutcome(alert.getAlertId(), List.of(), false);
        }

        List<DeliveryResult> results = new ArrayList<>();
        for (Recipient recipient : request.getRecipients()) {
            results.add(deliver(request, recipient));
        }

        boolean definitive = results.stream().allMatch(DeliveryResult::isDefinitive);
        if (definitive) {
            lifecycle.markNotified(alert.getAlertId());
        } else {
            LOG.warn("Notification for alert {} not definitive: {}", alert.getAlertId(), results);
        }
        DispatchOutcome outcome = new DispatchOutcome(alert.getAlertId(), results, definitive);
        LOG.info("Dispatched alert {} to {} recipient(s): {} sent, {} rejected, {} transient",
                alert.getAlertId(), results.size(), outcome.count(DeliveryResult.Status.SENT),
                outcome.count(DeliveryResult.Status.REJECTED), outcome.count(DeliveryResult.Status.TRANSIENT));
        return outcome;
    }

    private DeliveryResult deliver(NotificationRequest request, Recipient recipient) {
        NotificationChannel channel = channels.get(recipient.getChannel());
        if (channel == null) {
            LOG.warn("Channel '{}' is not enabled, rejecting delivery to {}", recipient.getChannel(),
                    recipient.getAddress());
            return DeliveryResult.rejected(recipient, "channel '" + recipient.getChannel() + "' not enabled");
        }
        try {
            return channel.deliver(request, recipient);
        } catch (RuntimeException e) {
            LOG.warn("Channel '{}' failed for {}", channel.name(), recipient, e);
            return DeliveryResult.transientFailure(recipient, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
