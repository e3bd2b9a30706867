package com.securezone.detector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.exception.SourceExhaustedException;
import com.securezone.capture.exception.SourceUnavailableException;
import com.securezone.capture.model.Frame;
import com.securezone.capture.service.FramePacer;
import com.securezone.capture.service.OpenCvVideoSource;
import com.securezone.capture.source.SourceLocator;
import com.securezone.capture.source.VideoSource;
import com.securezone.detector.exception.ConfigurationException;
import com.securezone.detector.model.DetectorConfig;
import com.securezone.detector.service.MotionPipeline;
import com.securezone.detector.service.RuntimeControls;
import com.securezone.detector.sink.JsonLinesEventLogger;
import com.securezone.detector.sink.OpenCvVideoRecorder;
import com.securezone.detector.sink.VideoRecorder;
import com.securezone.detector.utils.ConfigLoader;

@Slf4j
public class MotionMonitor {

    public enum StopReason {
        QUIT,
        END_OF_STREAM,
        SOURCE_UNAVAILABLE
    }

    private final VideoSource source;
    private final MotionPipeline pipeline;
    private final RuntimeControls controls;
    private final FramePacer pacer;
    private final Clock clock;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private long ticks = 0;

    public MotionMonitor(VideoSource source, MotionPipeline pipeline, RuntimeControls controls,
                         FramePacer pacer, Clock clock) {
        this.source = source;
        this.pipeline = pipeline;
        this.controls = controls;
        this.pacer = pacer;
        this.clock = clock;
    }

    public static void main(String[] args) {
        log.info("SECURE ZONE MONITOR - motion detection for restricted areas");
        try {
            DetectorConfig config = args.length > 0 ? ConfigLoader.load(args[0]) : ConfigLoader.loadDefault();
            StopReason reason = run(config, Clock.systemDefaultZone());
            log.info("Motion monitor stopped: {}", reason);
            if (reason == StopReason.SOURCE_UNAVAILABLE) {
                System.exit(1);
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
        } catch (SourceUnavailableException e) {
            log.error("Cannot open video source: {}", e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Application error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static StopReason run(DetectorConfig config, Clock clock) throws Exception {
        Path recordingsDir = Paths.get(config.getRecordingsDir());
        Files.createDirectories(recordingsDir);
        log.info("Directory structure verified");

        RuntimeControls controls = new RuntimeControls();
        SourceLocator locator = SourceLocator.parse(config.getVideoSource());

        try (JsonLinesEventLogger eventLogger = new JsonLinesEventLogger(Paths.get(config.getLogFile()));
             VideoSource source = OpenCvVideoSource.open(locator, clock,
                 config.getMaxEmptyReads(), config.getEmptyReadDelayMs())) {

            VideoRecorder recorder = config.getSaveVideos()
                ? new OpenCvVideoRecorder(recordingsDir, config.getOutputFps(), clock.getZone())
                : null;
            MotionPipeline pipeline = MotionPipeline.fromConfig(config, eventLogger, recorder, clock.getZone());
            FramePacer pacer = !source.isLive() && config.isThrottlePlayback() ? new FramePacer(source.fps()) : null;
            MotionMonitor monitor = new MotionMonitor(source, pipeline, controls, pacer, clock);

            Thread hook = new Thread(() -> {
                log.info("Shutting down motion monitor...");
                controls.requestQuit();
                monitor.awaitStopped(5, TimeUnit.SECONDS);
            }, "motion-monitor-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            controls.listen(System.in);
            log.info("Motion detection started. Press 'q' + Enter to quit, 'r' + Enter to reset background");

            StopReason reason = monitor.run();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down");
            }
            return reason;
        }
    }

    public StopReason run() throws ConfigurationException {
        Frame pending = null;
        try {
            if (source.width() <= 0 || source.height() <= 0) {
                try {
                    pending = source.next();
                } catch (SourceExhaustedException e) {
                    log.warn("Video source {} is empty", source.describe());
                    return StopReason.END_OF_STREAM;
                } catch (SourceUnavailableException e) {
                    log.error("Video source {} unavailable: {}", source.describe(), e.getMessage());
                    return StopReason.SOURCE_UNAVAILABLE;
                }
            }
            pipeline.prepare(source.width(), source.height());

            while (!controls.isQuitRequested()) {
                if (controls.consumeReset()) {
                    log.info("Resetting background model...");
                    pipeline.requestReset();
                }

                Frame frame = pending;
                pending = null;
                if (frame == null) {
                    try {
                        frame = source.next();
                    } catch (SourceExhaustedException e) {
                        log.info("Video source {} finished after {} frames", source.describe(), ticks);
                        return StopReason.END_OF_STREAM;
                    } catch (SourceUnavailableException e) {
                        log.error("Video source {} unavailable: {}", source.describe(), e.getMessage(), e);
                        return StopReason.SOURCE_UNAVAILABLE;
                    }
                }

                try (Frame current = frame) {
                    pipeline.tick(current);
                    ticks++;
                } catch (RuntimeException e) {
                    log.error("Failed to process frame {}", frame.getIndex(), e);
                }

                if (pacer != null) {
                    try {
                        pacer.pace();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.info("Interrupted, stopping");
                        return StopReason.QUIT;
                    }
                }
            }
            return StopReason.QUIT;
        } finally {
            if (pending != null) {
                pending.close();
            }
            pipeline.shutdown(clock.instant());
            stopped.countDown();
        }
    }

    public boolean awaitStopped(long timeout, TimeUnit unit) {
        try {
            return stopped.await(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long ticks() {
        return ticks;
    }
}
