package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LightingCondition implements WireNamed {
    GOOD("good"),
    MODERATE("moderate"),
    POOR("poor");

    private final String wireName;

    LightingCondition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static LightingCondition fromWireName(String value) {
        return WireNamed.fromWireName(LightingCondition.class, value);
    }
}
