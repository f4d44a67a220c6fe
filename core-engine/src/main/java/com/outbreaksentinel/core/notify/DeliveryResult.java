package com.outbreaksentinel.core.notify;

import java.util.Objects;

/**
 * Outcome of delivering one request to one recipient.
 *
 * <p>
 * {@link Status#SENT} and {@link Status#REJECTED} are definitive: sending
 * again would not change anything. {@link Status#TRANSIENT} may succeed on
 * a later attempt, which is the channel's concern and not the pipeline's.
 * </p>
 */
public final class DeliveryResult {

    public enum Status {
        SENT,
        REJECTED,
        TRANSIENT
    }

    private final Recipient recipient;
    private final Status status;
    private final String detail;

    private DeliveryResult(Recipient recipient, Status status, String detail) {
        this.recipient = Objects.requireNonNull(recipient, "recipient must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.detail = detail;
    }

    public static DeliveryResult sent(Recipient recipient) {
        return new DeliveryResult(recipient, Status.SENT, null);
    }

    public static DeliveryResult rejected(Recipient recipient, String detail) {
        return new DeliveryResult(recipient, Status.REJECTED, detail);
    }

    public static DeliveryResult transientFailure(Recipient recipient, String detail) {
        return new DeliveryResult(recipient, Status.TRANSIENT, detail);
    }

    public boolean isDefinitive() {
        return status != Status.TRANSIENT;
    }

    public Recipient getRecipient() {
        return recipient;
    }

    public Status getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return recipient + "=" + status + (detail != null ? " (" + detail + ")" : "");
    }
}
