package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty implements WireNamed {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    EXPERT("expert");

    private final String wireName;

    Difficulty(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Difficulty fromWireName(String value) {
        return WireNamed.fromWireName(Difficulty.class, value);
    }
}
