package com.ekkalavya.artraining.exception;

import java.util.UUID;

/**
 * Exception thrown when a training session is not found
 * Results in HTTP 404 Not Found
 */
public class SessionNotFoundException extends TrainingSessionException {

    public SessionNotFoundException(UUID sessionId) {
        super("SESSION_NOT_FOUND", "Training session not found with ID: " + sessionId);
    }
}
