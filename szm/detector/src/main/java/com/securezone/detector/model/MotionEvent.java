package com.securezone.detector.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

@Value
public class MotionEvent {

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    @JsonProperty("kind")
    EventKind kind;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    public MotionEvent(Instant timestamp, EventKind kind, Map<String, Object> metadata) {
        this.timestamp = timestamp;
        this.kind = kind;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
