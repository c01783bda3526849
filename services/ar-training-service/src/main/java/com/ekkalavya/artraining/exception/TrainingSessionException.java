package com.ekkalavya.artraining.exception;

/**
 * Base exception for all AR training service exceptions.
 * Carries a stable error code that the REST layer maps to a status.
 */
public class TrainingSessionException extends RuntimeException {

    private final String errorCode;

    public TrainingSessionException(String message) {
        super(message);
        this.errorCode = "TRAINING_SESSION_ERROR";
    }

    public TrainingSessionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TrainingSessionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
