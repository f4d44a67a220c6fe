package com.outbreaksentinel.core.narrative;

import com.outbreaksentinel.core.validation.Case;

/**
 * Produces a human-readable rationale for an escalated case.
 *
 * <p>
 * The text is supplementary evidence only; nothing in the pipeline branches
 * on it. Implementations may block on network I/O and are always called
 * through {@link TimeBoundedNarrator}.
 * </p>
 */
public interface NarrativeAssistant {

    /**
     * @param escalated case with severity and actions set
     * @return narrative text
     * @throws NarrativeUnavailableException if no narrative can be produced
     */
    String generateRationale(Case escalated);
}
