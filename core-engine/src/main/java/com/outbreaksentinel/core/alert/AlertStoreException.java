package com.outbreaksentinel.core.alert;

/**
 * The alert store failed to read or write.
 *
 * <p>
 * {@link #isTransient()} tells the lifecycle manager whether retrying can
 * help (an unreachable or busy store) or not (corrupt data, permissions).
 * </p>
 */
public class AlertStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public AlertStoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public AlertStoreException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
