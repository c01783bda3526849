package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a training session.
 *
 * <p>ACTIVE and PAUSED sessions accept updates; COMPLETED and FAILED are terminal
 * and only accept audit appends (safety incidents).
 */
public enum SessionStatus implements WireNamed {
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionStatus fromWireName(String value) {
        return WireNamed.fromWireName(SessionStatus.class, value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
