package com.securezone.capture.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_videoio;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;
import org.bytedeco.opencv.opencv_videoio.VideoWriter;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.securezone.capture.exception.SourceExhaustedException;
import com.securezone.capture.exception.SourceUnavailableException;
import com.securezone.capture.model.Frame;
import com.securezone.capture.source.SourceLocator;

class OpenCvVideoSourceTest {

    static {
        Loader.load(opencv_core.class);
        Loader.load(opencv_videoio.class);
    }

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T23:15:00Z"), ZoneOffset.UTC);

    @Test
    void cameraRetriesEmptyReadsThenRecovers() throws Exception {
        ScriptedCapture capture = new ScriptedCapture(false, false, true);
        OpenCvVideoSource source = new OpenCvVideoSource(SourceLocator.parse("0"), capture, CLOCK, 3, 1);

        try (Frame frame = source.next()) {
            assertEquals(0, frame.getIndex());
            assertEquals(CLOCK.instant(), frame.getTimestamp());
            assertEquals(3, capture.reads);
            assertEquals(8, source.width());
            assertEquals(6, source.height());
        } finally {
            source.close();
        }
    }

    @Test
    void cameraGivesUpAfterBoundedEmptyReads() {
        ScriptedCapture capture = new ScriptedCapture(false, false, false, false, true);
        OpenCvVideoSource source = new OpenCvVideoSource(SourceLocator.parse("1"), capture, CLOCK, 2, 1);

        assertThrows(SourceUnavailableException.class, source::next);
        assertEquals(3, capture.reads);
        source.close();
    }

    @Test
    void fileEndsAtFirstEmptyRead() throws Exception {
        ScriptedCapture capture = new ScriptedCapture(true, false);
        OpenCvVideoSource source = new OpenCvVideoSource(SourceLocator.parse("clip.avi"), capture, CLOCK, 5, 1);

        source.next().close();
        assertThrows(SourceExhaustedException.class, source::next);
        source.close();
    }

    @Test
    void missingFileIsUnavailable(@TempDir Path dir) {
        SourceLocator locator = SourceLocator.parse(dir.resolve("nope.avi").toString());

        assertThrows(SourceUnavailableException.class, () -> OpenCvVideoSource.open(locator, CLOCK, 1, 1));
    }

    @Test
    void readsRecordedClipUntilExhausted(@TempDir Path dir) throws Exception {
        Path clip = dir.resolve("clip.avi");
        VideoWriter writer = new VideoWriter(clip.toString(), opencv_videoio.CAP_OPENCV_MJPEG,
            VideoWriter.fourcc((byte) 'M', (byte) 'J', (byte) 'P', (byte) 'G'), 10, new Size(32, 24), true);
        Assumptions.assumeTrue(writer.isOpened(), "skip: MJPG writer unavailable");
        Mat image = new Mat(24, 32, opencv_core.CV_8UC3, new Scalar(90, 90, 90, 0));
        for (int i = 0; i < 3; i++) {
            writer.write(image);
        }
        writer.release();
        image.release();
        Assumptions.assumeTrue(Files.size(clip) > 0, "skip: clip not written");

        OpenCvVideoSource source = OpenCvVideoSource.open(SourceLocator.parse(clip.toString()), CLOCK, 1, 1);
        int frames = 0;
        try {
            while (true) {
                try (Frame frame = source.next()) {
                    assertEquals(32, frame.cols());
                    frames++;
                }
            }
        } catch (SourceExhaustedException expected) {
            assertEquals(3, frames);
        } finally {
            source.close();
        }
    }

    private static class ScriptedCapture extends VideoCapture {

        private final boolean[] script;
        int reads = 0;

        ScriptedCapture(boolean... script) {
            this.script = script;
        }

        @Override
        public boolean read(Mat image) {
            boolean ok = reads < script.length && script[reads];
            reads++;
            if (ok) {
                new Mat(6, 8, opencv_core.CV_8UC3, new Scalar(10, 20, 30, 0)).copyTo(image);
            }
            return ok;
        }

        @Override
        public boolean isOpened() {
            return true;
        }

        @Override
        public double get(int propId) {
            return 0;
        }
    }
}
