package com.securezone.detector.service;

import java.time.Duration;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.RecordingIOException;
import com.securezone.detector.sink.RecordingHandle;
import com.securezone.detector.sink.VideoRecorder;

/**
 * One bounded-duration clip. The session ends on its own schedule, never because motion
 * stopped or resumed; {@link #close()} releases the recorder handle and is safe to repeat.
 */
@Slf4j
public class RecordingSession implements AutoCloseable {

    private final VideoRecorder recorder;
    private final RecordingHandle handle;
    private final Instant startTime;
    private final Duration plannedDuration;

    private long framesWritten = 0;
    private boolean closed = false;

    private RecordingSession(VideoRecorder recorder, RecordingHandle handle, Instant startTime,
                             Duration plannedDuration) {
        this.recorder = recorder;
        this.handle = handle;
        this.startTime = startTime;
        this.plannedDuration = plannedDuration;
    }

    public static RecordingSession open(VideoRecorder recorder, Instant startTime, Duration plannedDuration,
                                        int width, int height) throws RecordingIOException {
        RecordingHandle handle = recorder.open(startTime, plannedDuration, width, height);
        return new RecordingSession(recorder, handle, startTime, plannedDuration);
    }

    public void submitFrame(Frame frame) throws RecordingIOException {
        if (closed) {
            throw new RecordingIOException("Recording " + handle.getId() + " is already closed");
        }
        recorder.write(handle, frame);
        framesWritten++;
    }

    public boolean isExpired(Instant now) {
        return !Duration.between(startTime, now).minus(plannedDuration).isNegative();
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startTime, now);
    }

    public boolean isOpen() {
        return !closed;
    }

    public long framesWritten() {
        return framesWritten;
    }

    public RecordingHandle handle() {
        return handle;
    }

    @Override
    public void close() throws RecordingIOException {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Closing recording {} after {} frames", handle.getId(), framesWritten);
        recorder.close(handle);
    }
}
