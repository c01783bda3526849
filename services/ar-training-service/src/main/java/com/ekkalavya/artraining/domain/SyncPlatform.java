package com.ekkalavya.artraining.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Client platforms that report room-session quality metrics.
 */
public enum SyncPlatform implements WireNamed {
    WEB_MEDIAPIPE("web_mediapipe"),
    FLUTTER_UNITY("flutter_unity");

    private final String wireName;

    SyncPlatform(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SyncPlatform fromWireName(String value) {
        return WireNamed.fromWireName(SyncPlatform.class, value);
    }
}
