package com.ekkalavya.artraining.exception;

import java.util.UUID;

/**
 * Sync payload references a missing or terminal session.
 * Results in HTTP 409 Conflict
 */
public class SyncConflictException extends TrainingSessionException {

    public SyncConflictException(UUID sessionId, String reason) {
        super("SYNC_CONFLICT", String.format("Cannot sync session %s: %s", sessionId, reason));
    }
}
