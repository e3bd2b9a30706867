package com.securezone.capture.source;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class SourceLocator {

    private static final String[] VIDEO_DIRS = {
        "videos",
        "data/videos",
        "../videos"
    };

    private final Integer cameraIndex;
    private final String path;

    private SourceLocator(Integer cameraIndex, String path) {
        this.cameraIndex = cameraIndex;
        this.path = path;
    }

    public static SourceLocator parse(String videoSource) {
        Objects.requireNonNull(videoSource, "video_source must be provided");
        String value = videoSource.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("video_source must not be blank");
        }
        if (value.matches("\\d+")) {
            return new SourceLocator(Integer.parseInt(value), null);
        }
        return new SourceLocator(null, value);
    }

    public boolean isCamera() {
        return cameraIndex != null;
    }

    public int cameraIndex() {
        if (cameraIndex == null) {
            throw new IllegalStateException("Not a camera source: " + path);
        }
        return cameraIndex;
    }

    public String path() {
        return path;
    }

    /**
     * Resolves a file source against the working directory and the usual video
     * directories. Stream URLs and unresolvable paths are returned as-is.
     */
    public String resolvePath() {
        if (isCamera()) {
            throw new IllegalStateException("Camera source has no path: " + cameraIndex);
        }
        if (path.contains("://")) {
            return path;
        }

        File direct = new File(path);
        if (direct.isFile()) {
            return direct.getAbsolutePath().replace('\\', '/');
        }

        Path currentDir = Paths.get("").toAbsolutePath();
        String filename = Paths.get(path).getFileName().toString();
        for (String videoDir : VIDEO_DIRS) {
            Path resolved = currentDir.resolve(videoDir).resolve(filename).normalize();
            if (resolved.toFile().isFile()) {
                log.debug("Found file in video directory '{}': {} -> {}", videoDir, path, resolved);
                return resolved.toString().replace('\\', '/');
            }
        }

        log.warn("Could not resolve video path: {} (current dir: {}), using as-is", path, currentDir);
        return path.replace('\\', '/');
    }

    @Override
    public String toString() {
        return isCamera() ? "camera:" + cameraIndex : "file:" + path;
    }
}
