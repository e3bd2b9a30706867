package com.securezone.detector.sink;

import java.time.Duration;
import java.time.Instant;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.RecordingIOException;

public interface VideoRecorder {

    RecordingHandle open(Instant startedAt, Duration targetDuration, int width, int height)
        throws RecordingIOException;

    void write(RecordingHandle handle, Frame frame) throws RecordingIOException;

    void close(RecordingHandle handle) throws RecordingIOException;
}
