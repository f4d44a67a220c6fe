package com.outbreaksentinel.core.narrative;

/**
 * The narrative assistant could not produce a rationale. Always recovered
 * from by falling back to the numeric rationale.
 */
public class NarrativeUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NarrativeUnavailableException(String message) {
        super(message);
    }

    public NarrativeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
