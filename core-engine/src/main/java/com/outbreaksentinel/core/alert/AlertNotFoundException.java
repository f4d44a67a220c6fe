package com.outbreaksentinel.core.alert;

public class AlertNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
