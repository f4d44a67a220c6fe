package com.outbreaksentinel.core.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * POSTs the {@link NotificationRequest} as JSON to the recipient's address.
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>2xx: sent</li>
 * <li>4xx or an unusable URL: rejected</li>
 * <li>5xx, I/O error or timeout: transient</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    public static final String NAME = "webhook";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebhookNotificationChannel(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    WebhookNotificationChannel(HttpClient httpClient, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(NotificationRequest request, Recipient recipient) {
        URI target;
        try {
            target = URI.create(recipient.getAddress());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.rejected(recipient, "invalid webhook URL: " + e.getMessage());
        }
        if (target.getScheme() == null || !target.getScheme().startsWith("http")) {
            return DeliveryResult.rejected(recipient, "webhook URL must be http(s)");
        }

        String payload;
        try {
            payload = mapper.writeValueAsString(request);
        } catch (IOException e) {
            return DeliveryResult.rejected(recipient, "payload not serializable: " + e.getMessage());
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(target)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            return classify(recipient, response.statusCode());
        } catch (IOException e) {
            LOG.warn("Webhook {} unreachable for alert {}: {}", target, request.getAlertId(), e.getMessage());
            return DeliveryResult.transientFailure(recipient, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.transientFailure(recipient, "interrupted");
        }
    }

    static DeliveryResult classify(Recipient recipient, int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return DeliveryResult.sent(recipient);
        }
        if (statusCode >= 400 && statusCode < 500) {
            return DeliveryResult.rejected(recipient, "HTTP " + statusCode);
        }
        return DeliveryResult.transientFailure(recipient, "HTTP " + statusCode);
    }
}
