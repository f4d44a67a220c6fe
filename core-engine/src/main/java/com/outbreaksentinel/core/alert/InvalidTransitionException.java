package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.model.AlertStatus;

/**
 * A status change the alert state machine does not allow, including any
 * change away from {@code resolved}.
 */
public class InvalidTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final AlertStatus from;
    private final AlertStatus to;

    public InvalidTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot transition from " + from.key() + " to " + to.key());
        this.alertId = alertId;
        this.from = from;
        this.to = to;
    }

    public String getAlertId() {
        return alertId;
    }

    public AlertStatus getFrom() {
        return from;
    }

    public AlertStatus getTo() {
        return to;
    }
}
