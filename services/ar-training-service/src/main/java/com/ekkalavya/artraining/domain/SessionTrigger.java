package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Events that drive session status transitions.
 */
public enum SessionTrigger implements WireNamed {
    PAUSE("pause"),                 // client requested pause
    RESUME("resume"),               // client resumed a paused drill
    END("end"),                     // client finished the drill
    SAFETY_PAUSE("safety_pause"),   // automatic pause raised by a critical safety incident
    FAIL("fail");                   // unrecoverable upstream error

    private final String wireName;

    SessionTrigger(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionTrigger fromWireName(String value) {
        return WireNamed.fromWireName(SessionTrigger.class, value);
    }
}
