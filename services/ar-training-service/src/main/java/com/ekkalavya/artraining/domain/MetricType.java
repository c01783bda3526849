package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricType implements WireNamed {
    PRECISION("precision"),
    PACE("pace"),
    STREAK("streak"),
    ACCURACY("accuracy");

    private final String wireName;

    MetricType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static MetricType fromWireName(String value) {
        return WireNamed.fromWireName(MetricType.class, value);
    }
}
