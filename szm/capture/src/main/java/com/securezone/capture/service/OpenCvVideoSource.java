package com.securezone.capture.service;

import java.io.File;
import java.time.Clock;

import org.bytedeco.opencv.global.opencv_videoio;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.exception.SourceExhaustedException;
import com.securezone.capture.exception.SourceUnavailableException;
import com.securezone.capture.model.Frame;
import com.securezone.capture.source.SourceLocator;
import com.securezone.capture.source.VideoSource;

/**
 * {@link VideoSource} over an OpenCV {@link VideoCapture}. Cameras tolerate a bounded
 * number of empty reads before giving up; files end at the first empty read.
 */
@Slf4j
public class OpenCvVideoSource implements VideoSource {

    static final double DEFAULT_FPS = 30.0;

    private final SourceLocator locator;
    private final VideoCapture capture;
    private final Clock clock;
    private final int maxEmptyReads;
    private final long emptyReadDelayMs;

    private long frameIndex = 0;
    private int width;
    private int height;
    private boolean closed = false;

    OpenCvVideoSource(SourceLocator locator, VideoCapture capture, Clock clock,
                      int maxEmptyReads, long emptyReadDelayMs) {
        this.locator = locator;
        this.capture = capture;
        this.clock = clock;
        this.maxEmptyReads = maxEmptyReads;
        this.emptyReadDelayMs = emptyReadDelayMs;
        this.width = (int) capture.get(opencv_videoio.CAP_PROP_FRAME_WIDTH);
        this.height = (int) capture.get(opencv_videoio.CAP_PROP_FRAME_HEIGHT);
    }

    public static OpenCvVideoSource open(SourceLocator locator, Clock clock,
                                         int maxEmptyReads, long emptyReadDelayMs)
            throws SourceUnavailableException {
        VideoCapture capture = openCapture(locator);

        if (!capture.isOpened()) {
            log.warn("Failed to open {} on first attempt, retrying in {} ms", locator, emptyReadDelayMs);
            sleep(emptyReadDelayMs);
            reopen(capture, locator);
            if (!capture.isOpened()) {
                capture.release();
                log.error("Failed to open video source after retry: {}", locator);
                throw new SourceUnavailableException("Error opening video source " + locator
                    + ". Check camera index/path.");
            }
            log.info("Video source opened after retry: {}", locator);
        } else {
            log.info("Video source opened on first attempt: {}", locator);
        }

        OpenCvVideoSource source = new OpenCvVideoSource(locator, capture, clock, maxEmptyReads, emptyReadDelayMs);
        log.info("Video capture initialized: {}x{} @ {}fps", source.width(), source.height(), source.fps());
        return source;
    }

    private static VideoCapture openCapture(SourceLocator locator) throws SourceUnavailableException {
        if (locator.isCamera()) {
            log.info("Opening camera index: {}", locator.cameraIndex());
            return new VideoCapture(locator.cameraIndex());
        }
        String resolvedPath = locator.resolvePath();
        log.info("Resolved video path: {} -> {}", locator.path(), resolvedPath);
        if (!resolvedPath.contains("://") && !new File(resolvedPath).isFile()) {
            throw new SourceUnavailableException("Video file not found: " + resolvedPath);
        }
        return new VideoCapture(resolvedPath);
    }

    private static void reopen(VideoCapture capture, SourceLocator locator) {
        if (locator.isCamera()) {
            capture.open(locator.cameraIndex());
        } else {
            capture.open(locator.resolvePath());
        }
    }

    @Override
    public Frame next() throws SourceExhaustedException, SourceUnavailableException {
        if (closed) {
            throw new SourceUnavailableException("Video source already closed: " + locator);
        }
        Mat mat = new Mat();
        int emptyReads = 0;
        while (!capture.read(mat) || mat.empty()) {
            if (!isLive()) {
                mat.release();
                log.info("End of video reached for {} after {} frames", locator, frameIndex);
                throw new SourceExhaustedException("End of stream: " + locator);
            }
            emptyReads++;
            if (emptyReads > maxEmptyReads) {
                mat.release();
                log.error("Camera {} returned {} empty reads in a row", locator, emptyReads);
                throw new SourceUnavailableException("Camera stopped delivering frames: " + locator);
            }
            log.warn("Failed to grab frame from {} (attempt {}/{})", locator, emptyReads, maxEmptyReads);
            try {
                Thread.sleep(emptyReadDelayMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                mat.release();
                throw new SourceUnavailableException("Interrupted while waiting for camera " + locator, ie);
            }
        }

        if (width <= 0 || height <= 0) {
            width = mat.cols();
            height = mat.rows();
        }
        return new Frame(frameIndex++, clock.instant(), mat);
    }

    @Override
    public boolean isLive() {
        return locator.isCamera();
    }

    @Override
    public double fps() {
        double fps = capture.get(opencv_videoio.CAP_PROP_FPS);
        return fps > 0 ? fps : DEFAULT_FPS;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public String describe() {
        return locator.toString();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            capture.release();
            log.info("Video source released: {} ({} frames read)", locator, frameIndex);
        }
    }

    private static void sleep(long millis) throws SourceUnavailableException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while opening video source", ie);
        }
    }
}
