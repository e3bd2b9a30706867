package com.securezone.detector.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.RecordingIOException;
import com.securezone.detector.support.TestFrames;

class OpenCvVideoRecorderTest {

    private static final Instant START = Instant.parse("2024-03-01T23:15:30Z");

    private static RecordingHandle openOrSkip(OpenCvVideoRecorder recorder, Instant at) {
        try {
            return recorder.open(at, Duration.ofSeconds(5), 64, 48);
        } catch (RecordingIOException e) {
            assumeTrue(false, "MJPG writer not available: " + e.getMessage());
            return null;
        }
    }

    @Test
    void writesTimestampedClip(@TempDir Path dir) throws Exception {
        OpenCvVideoRecorder recorder = new OpenCvVideoRecorder(dir, 10, ZoneOffset.UTC);
        RecordingHandle handle = openOrSkip(recorder, START);

        for (int i = 0; i < 5; i++) {
            try (Frame frame = TestFrames.frame(i, START, TestFrames.uniform(64, 48, i * 40))) {
                recorder.write(handle, frame);
            }
        }
        recorder.close(handle);

        Path clip = dir.resolve("motion_20240301_231530.avi");
        assertEquals(clip.toAbsolutePath().normalize().toString().replace("\\", "/"), handle.getTarget());
        assertTrue(Files.size(clip) > 0);
    }

    @Test
    void clipsStartedInTheSameSecondGetDistinctNames(@TempDir Path dir) throws Exception {
        OpenCvVideoRecorder recorder = new OpenCvVideoRecorder(dir, 10, ZoneOffset.UTC);

        RecordingHandle first = openOrSkip(recorder, START);
        RecordingHandle second = openOrSkip(recorder, START);

        assertNotEquals(first.getTarget(), second.getTarget());
        recorder.close(first);
        recorder.close(second);
    }

    @Test
    void rejectsFramesOfAnotherSize(@TempDir Path dir) throws Exception {
        OpenCvVideoRecorder recorder = new OpenCvVideoRecorder(dir, 10, ZoneOffset.UTC);
        RecordingHandle handle = openOrSkip(recorder, START);

        try (Frame frame = TestFrames.frame(0, START, TestFrames.uniform(32, 24, 0))) {
            assertThrows(RecordingIOException.class, () -> recorder.write(handle, frame));
        } finally {
            recorder.close(handle);
        }
    }

    @Test
    void closedClipRejectsFrames(@TempDir Path dir) throws Exception {
        OpenCvVideoRecorder recorder = new OpenCvVideoRecorder(dir, 10, ZoneOffset.UTC);
        RecordingHandle handle = openOrSkip(recorder, START);
        recorder.close(handle);
        recorder.close(handle);

        try (Frame frame = TestFrames.frame(0, START, TestFrames.uniform(64, 48, 0))) {
            assertThrows(RecordingIOException.class, () -> recorder.write(handle, frame));
        }
    }
}
