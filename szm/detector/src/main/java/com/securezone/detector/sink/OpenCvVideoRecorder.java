package com.securezone.detector.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_videoio.VideoWriter;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.RecordingIOException;

/**
 * Writes MJPG {@code .avi} clips named {@code motion_yyyyMMdd_HHmmss.avi}.
 */
@Slf4j
public class OpenCvVideoRecorder implements VideoRecorder {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final double fps;
    private final ZoneId zone;
    private final Map<String, OpenClip> clips = new ConcurrentHashMap<>();

    public OpenCvVideoRecorder(Path outputDir, double fps, ZoneId zone) {
        this.outputDir = outputDir.toAbsolutePath().normalize();
        this.fps = fps;
        this.zone = zone;
    }

    @Override
    public RecordingHandle open(Instant startedAt, Duration targetDuration, int width, int height)
            throws RecordingIOException {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new RecordingIOException("Cannot create recordings directory " + outputDir, e);
        }
        if (!Files.isWritable(outputDir)) {
            throw new RecordingIOException("Recordings directory is not writable: " + outputDir);
        }

        Path target = uniqueTarget(FILE_STAMP.format(startedAt.atZone(zone)));
        String pathStr = target.toString().replace("\\", "/");
        int fourcc = VideoWriter.fourcc((byte) 'M', (byte) 'J', (byte) 'P', (byte) 'G');

        VideoWriter writer;
        try {
            writer = new VideoWriter(pathStr, fourcc, fps, new Size(width, height), true);
        } catch (RuntimeException e) {
            throw new RecordingIOException("OpenCV failed to open video writer for " + pathStr, e);
        }
        if (!writer.isOpened()) {
            writer.release();
            throw new RecordingIOException("Failed to open video writer for " + pathStr);
        }

        RecordingHandle handle = new RecordingHandle(target.getFileName().toString(), pathStr, startedAt);
        clips.put(handle.getId(), new OpenClip(writer, width, height));
        log.info("Recording to {} ({}x{} @ {} fps, planned {} s)", pathStr, width, height, fps,
            targetDuration.toMillis() / 1000.0);
        return handle;
    }

    @Override
    public void write(RecordingHandle handle, Frame frame) throws RecordingIOException {
        OpenClip clip = clips.get(handle.getId());
        if (clip == null || !clip.writer.isOpened()) {
            throw new RecordingIOException("Recording " + handle.getId() + " is not open");
        }
        if (frame.cols() != clip.width || frame.rows() != clip.height) {
            throw new RecordingIOException("Frame " + frame.getIndex() + " is " + frame.cols() + "x" + frame.rows()
                + ", recording " + handle.getId() + " expects " + clip.width + "x" + clip.height);
        }
        try {
            clip.writer.write(frame.getImage());
        } catch (RuntimeException e) {
            throw new RecordingIOException("Failed to write frame " + frame.getIndex() + " to " + handle.getTarget(), e);
        }
    }

    @Override
    public void close(RecordingHandle handle) throws RecordingIOException {
        OpenClip clip = clips.remove(handle.getId());
        if (clip == null) {
            return;
        }
        try {
            clip.writer.release();
        } catch (RuntimeException e) {
            throw new RecordingIOException("Failed to finalize " + handle.getTarget(), e);
        }
        log.info("Recording saved: {}", handle.getTarget());
    }

    private Path uniqueTarget(String stamp) {
        Path target = outputDir.resolve("motion_" + stamp + ".avi");
        int suffix = 1;
        while (Files.exists(target) || clips.containsKey(target.getFileName().toString())) {
            target = outputDir.resolve("motion_" + stamp + "_" + suffix++ + ".avi");
        }
        return target;
    }

    private static final class OpenClip {
        private final VideoWriter writer;
        private final int width;
        private final int height;

        private OpenClip(VideoWriter writer, int width, int height) {
            this.writer = writer;
            this.width = width;
            this.height = height;
        }
    }
}
