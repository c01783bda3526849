package com.ekkalavya.artraining.exception;

/**
 * Malformed or out-of-range input. Nothing is persisted when this is raised.
 * Results in HTTP 400 Bad Request
 */
public class TrainingValidationException extends TrainingSessionException {

    public TrainingValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
