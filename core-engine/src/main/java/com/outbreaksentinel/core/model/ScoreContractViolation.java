package com.outbreaksentinel.core.model;

/**
 * Raised when a scoring or fusion step breaks its numeric contract, e.g. a
 * normalizer producing a value outside [0, 1] or fusion weights drifting away
 * from a unit sum.
 *
 * <p>
 * This is a programming error, not a data error. It is fatal to the cell
 * being processed but never to the batch.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoreContractViolation extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ScoreContractViolation(String message) {
        super(message);
    }
}
