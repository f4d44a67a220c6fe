package com.outbreaksentinel.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the notification to the application log. Always succeeds.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(NotificationRequest request, Recipient recipient) {
        LOG.warn("NOTIFY [{}] {}\n{}", recipient.getAddress(), request.getSubject(), request.getBody());
        return DeliveryResult.sent(recipient);
    }
}
