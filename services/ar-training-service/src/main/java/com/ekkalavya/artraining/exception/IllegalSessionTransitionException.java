package com.ekkalavya.artraining.exception;

import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SessionTrigger;

/**
 * Thrown when a trigger is not allowed from the session's current status.
 * Results in HTTP 409 Conflict
 */
public class IllegalSessionTransitionException extends TrainingSessionException {

    private final SessionStatus from;
    private final SessionTrigger trigger;

    public IllegalSessionTransitionException(SessionStatus from, SessionTrigger trigger) {
        super("ILLEGAL_TRANSITION",
              String.format("Transition %s is not allowed from status %s", trigger, from));
        this.from = from;
        this.trigger = trigger;
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionTrigger getTrigger() {
        return trigger;
    }
}
