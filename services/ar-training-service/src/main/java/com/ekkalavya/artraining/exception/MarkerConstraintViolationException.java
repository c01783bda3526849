package com.ekkalavya.artraining.exception;

/**
 * A generated marker landed outside the safety-margin rectangle.
 * Indicates a layout bug rather than bad input, so it maps to HTTP 500.
 */
public class MarkerConstraintViolationException extends TrainingSessionException {

    public MarkerConstraintViolationException(String message) {
        super("CONSTRAINT_VIOLATION", message);
    }
}
