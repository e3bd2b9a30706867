package com.securezone.capture.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceLocatorTest {

    @Test
    void digitsSelectCameraIndex() {
        SourceLocator locator = SourceLocator.parse(" 2 ");

        assertTrue(locator.isCamera());
        assertEquals(2, locator.cameraIndex());
        assertEquals("camera:2", locator.toString());
    }

    @Test
    void anythingElseIsAFilePath() {
        SourceLocator locator = SourceLocator.parse("clips/atm.mp4");

        assertFalse(locator.isCamera());
        assertEquals("clips/atm.mp4", locator.path());
        assertThrows(IllegalStateException.class, locator::cameraIndex);
    }

    @Test
    void blankSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SourceLocator.parse("   "));
        assertThrows(NullPointerException.class, () -> SourceLocator.parse(null));
    }

    @Test
    void existingFileResolvesToAbsolutePath(@TempDir Path dir) throws IOException {
        Path video = Files.createFile(dir.resolve("vault.avi"));

        SourceLocator locator = SourceLocator.parse(video.toString());

        assertEquals(video.toAbsolutePath().toString().replace('\\', '/'), locator.resolvePath());
    }

    @Test
    void streamUrlsAreKeptVerbatim() {
        SourceLocator locator = SourceLocator.parse("rtsp://10.0.0.5/stream1");

        assertEquals("rtsp://10.0.0.5/stream1", locator.resolvePath());
    }
}
