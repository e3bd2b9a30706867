package com.securezone.detector.sink;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;

import com.securezone.detector.model.EventKind;
import com.securezone.detector.model.MotionEvent;

@Slf4j
public class JsonLinesEventLogger implements EventLogger, Closeable {

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path logFile;
    private final BufferedWriter writer;
    private long written = 0;

    public JsonLinesEventLogger(Path logFile) throws IOException {
        this.logFile = logFile.toAbsolutePath().normalize();
        Path parent = this.logFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(this.logFile, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.info("Event log opened: {}", this.logFile);
    }

    @Override
    public synchronized void log(MotionEvent event) {
        try {
            writer.write(objectMapper.writeValueAsString(event));
            writer.newLine();
            writer.flush();
            written++;
        } catch (IOException e) {
            log.error("Failed to append {} event to {}", event.getKind().wireName(), logFile, e);
            return;
        }

        if (event.getKind() == EventKind.MOTION) {
            log.debug("Motion in ROI at {}", event.getTimestamp());
        } else {
            log.info("Event {} at {} {}", event.getKind().wireName(), event.getTimestamp(), event.getMetadata());
        }
    }

    public long written() {
        return written;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        log.info("Event log closed: {} ({} records written)", logFile, written);
    }
}
