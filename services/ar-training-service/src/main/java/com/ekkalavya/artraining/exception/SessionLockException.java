package com.ekkalavya.artraining.exception;

/**
 * Could not acquire the per-session lock in time.
 * Results in HTTP 503 Service Unavailable
 */
public class SessionLockException extends TrainingSessionException {

    public SessionLockException(String message) {
        super("SESSION_LOCK_TIMEOUT", message);
    }

    public SessionLockException(String message, Throwable cause) {
        super("SESSION_LOCK_TIMEOUT", message, cause);
    }
}
