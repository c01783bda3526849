package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DevicePlatform implements WireNamed {
    ANDROID("android"),
    IOS("ios"),
    WEB("web");

    private final String wireName;

    DevicePlatform(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static DevicePlatform fromWireName(String value) {
        return WireNamed.fromWireName(DevicePlatform.class, value);
    }
}
