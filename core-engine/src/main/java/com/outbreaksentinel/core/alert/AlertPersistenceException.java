package com.outbreaksentinel.core.alert;

/**
 * An alert write could not be completed after the bounded retries. The cell
 * that triggered it is left for the next run.
 */
public class AlertPersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public AlertPersistenceException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
