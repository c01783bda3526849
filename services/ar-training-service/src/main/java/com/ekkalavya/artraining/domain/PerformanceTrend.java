package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a user's recent sessions compared with their earlier ones.
 */
public enum PerformanceTrend implements WireNamed {
    IMPROVING("improving"),
    DECLINING("declining"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String wireName;

    PerformanceTrend(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static PerformanceTrend fromWireName(String value) {
        return WireNamed.fromWireName(PerformanceTrend.class, value);
    }
}
