package com.outbreaksentinel.core.notify;

/**
 * A way of reaching a recipient.
 *
 * <p>
 * Implementations classify their own failures into
 * {@link DeliveryResult.Status}. An exception escaping {@link #deliver} is
 * treated as a transient failure by the dispatcher.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationChannel {

    /** Channel name as used in recipient rules ({@code log}, {@code webhook}, {@code kafka}). */
    String name();

    DeliveryResult deliver(NotificationRequest request, Recipient recipient);
}
