package com.securezone.detector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    MOTION_STARTED("motion-started"),
    MOTION("motion"),
    MOTION_ENDED("motion-ended"),
    RECORDING_STARTED("recording-started"),
    RECORDING_ENDED("recording-ended");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
