package com.ekkalavya.artraining.exception;

import com.ekkalavya.artraining.domain.SessionStatus;

import java.util.UUID;

/**
 * Results in HTTP 409 Conflict
 */
public class SessionNotActiveException extends TrainingSessionException {

    public SessionNotActiveException(UUID sessionId, SessionStatus status) {
        super("SESSION_NOT_ACTIVE",
              String.format("Training session %s is %s, expected ACTIVE", sessionId, status));
    }
}
