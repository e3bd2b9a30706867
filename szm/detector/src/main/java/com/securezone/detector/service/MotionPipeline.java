package com.securezone.detector.service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.ConfigurationException;
import com.securezone.detector.exception.NotReadyException;
import com.securezone.detector.model.CandidateRegion;
import com.securezone.detector.model.DetectorConfig;
import com.securezone.detector.model.RegionOfInterest;
import com.securezone.detector.model.TickOutcome;
import com.securezone.detector.sink.EventLogger;
import com.securezone.detector.sink.VideoRecorder;

@Slf4j
public class MotionPipeline {

    private final BackgroundModel background;
    private final FrameProcessor processor;
    private final RoiFilter roiFilter;
    private final MotionStateMachine stateMachine;
    private final ZoneId zone;
    private final AtomicBoolean resetRequested = new AtomicBoolean(false);

    private volatile RegionOfInterest roi;
    private int frameWidth = -1;
    private int frameHeight = -1;

    public MotionPipeline(BackgroundModel background, FrameProcessor processor, RoiFilter roiFilter,
                          MotionStateMachine stateMachine, RegionOfInterest roi, ZoneId zone) {
        this.background = background;
        this.processor = processor;
        this.roiFilter = roiFilter;
        this.stateMachine = stateMachine;
        this.roi = roi;
        this.zone = zone;
    }

    public static MotionPipeline fromConfig(DetectorConfig config, EventLogger eventLogger,
                                            VideoRecorder recorder, ZoneId zone) {
        FramePreprocessor preprocessor = new FramePreprocessor(config.getBlurKernel());
        return new MotionPipeline(
            new BackgroundModel(config.getBgFrames(), preprocessor),
            FrameProcessor.fromConfig(config, preprocessor),
            new RoiFilter(),
            MotionStateMachine.fromConfig(config, eventLogger, recorder),
            config.regionOfInterest(),
            zone);
    }

    public void prepare(int width, int height) throws ConfigurationException {
        if (!roi.fitsWithin(width, height)) {
            throw new ConfigurationException("roi " + roi + " does not fit inside the "
                + width + "x" + height + " frame");
        }
        this.frameWidth = width;
        this.frameHeight = height;
        log.info("Monitoring ROI {} in {}x{} frames", roi, width, height);
    }

    public TickOutcome tick(Frame frame) {
        ZonedDateTime now = frame.getTimestamp().atZone(zone);
        if (resetRequested.getAndSet(false)) {
            background.reset();
        }

        if (!background.isReady()) {
            background.ingest(frame.getImage());
            return stateMachine.onCalibrating(frame, now);
        }

        List<CandidateRegion> regions;
        try {
            regions = processor.process(frame.getImage(), background);
        } catch (NotReadyException e) {
            log.debug("Skipping decision for frame {}: {}", frame.getIndex(), e.getMessage());
            return stateMachine.onCalibrating(frame, now);
        }
        List<CandidateRegion> inRoi = roiFilter.filter(regions, roi);
        if (log.isTraceEnabled()) {
            log.trace("Frame {}: {} regions, {} in ROI", frame.getIndex(), regions.size(), inRoi.size());
        }
        return stateMachine.onFrame(frame, inRoi, now);
    }

    /**
     * Asks for a fresh background; applied at the start of the next tick.
     */
    public void requestReset() {
        resetRequested.set(true);
    }

    public void swapRoi(RegionOfInterest replacement) throws ConfigurationException {
        if (frameWidth > 0 && !replacement.fitsWithin(frameWidth, frameHeight)) {
            throw new ConfigurationException("roi " + replacement + " does not fit inside the "
                + frameWidth + "x" + frameHeight + " frame");
        }
        log.info("ROI changed from {} to {}", roi, replacement);
        this.roi = replacement;
    }

    public void shutdown(Instant now) {
        stateMachine.shutdown(now);
    }

    public RegionOfInterest roi() {
        return roi;
    }

    public BackgroundModel background() {
        return background;
    }

    public MotionStateMachine stateMachine() {
        return stateMachine;
    }
}
