package com.securezone.detector.sink;

import java.time.Instant;

import lombok.Value;

@Value
public class RecordingHandle {

    String id;
    String target;
    Instant startedAt;
}
