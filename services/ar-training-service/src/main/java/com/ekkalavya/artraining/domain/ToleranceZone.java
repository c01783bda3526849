package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a point lands relative to a target's tolerance radius.
 */
public enum ToleranceZone implements WireNamed {
    PERFECT("perfect"),  // within 20% of the radius
    HIT("hit"),
    MISS("miss");

    private final String wireName;

    ToleranceZone(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ToleranceZone fromWireName(String value) {
        return WireNamed.fromWireName(ToleranceZone.class, value);
    }

    public boolean isHit() {
        return this != MISS;
    }
}
