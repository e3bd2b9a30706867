package com.securezone.detector.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.slf4j.Slf4j;

import com.securezone.capture.model.Frame;
import com.securezone.detector.exception.RecordingIOException;
import com.securezone.detector.model.CandidateRegion;
import com.securezone.detector.model.DetectorConfig;
import com.securezone.detector.model.EventKind;
import com.securezone.detector.model.MotionEvent;
import com.securezone.detector.model.MotionState;
import com.securezone.detector.model.TickOutcome;
import com.securezone.detector.sink.EventLogger;
import com.securezone.detector.sink.VideoRecorder;

/**
 * Turns per-frame ROI detections into IDLE/ACTIVE transitions, events and at most one
 * bounded recording. Single-threaded: every method must be called from the pipeline
 * thread.
 *
 * <p>A tick runs in this order: close an expired recording, decide the new state, emit
 * edge and ongoing events (opening a recording on IDLE to ACTIVE), then hand the frame
 * to the open recording if there is one.
 */
@Slf4j
public class MotionStateMachine {

    private final ScheduleGate scheduleGate;
    private final MotionDebouncer debouncer;
    private final EventLogger eventLogger;
    private final VideoRecorder recorder;
    private final boolean saveVideos;
    private final Duration recordDuration;
    private final String cameraId;
    private final List<MotionListener> listeners = new CopyOnWriteArrayList<>();

    private MotionState state = MotionState.IDLE;
    private Instant lastActive;
    private Instant activeSince;
    private RecordingSession session;

    public MotionStateMachine(ScheduleGate scheduleGate, MotionDebouncer debouncer, EventLogger eventLogger,
                              VideoRecorder recorder, boolean saveVideos, Duration recordDuration, String cameraId) {
        if (saveVideos && recorder == null) {
            throw new IllegalArgumentException("save_videos requires a video recorder");
        }
        this.scheduleGate = scheduleGate;
        this.debouncer = debouncer;
        this.eventLogger = eventLogger;
        this.recorder = recorder;
        this.saveVideos = saveVideos;
        this.recordDuration = recordDuration;
        this.cameraId = cameraId;
    }

    public static MotionStateMachine fromConfig(DetectorConfig config, EventLogger eventLogger,
                                                VideoRecorder recorder) {
        return new MotionStateMachine(
            new ScheduleGate(config.scheduleWindow()),
            new MotionDebouncer(config.getConfirmWindow(), config.getConfirmFrames()),
            eventLogger,
            recorder,
            config.getSaveVideos(),
            config.recordDurationAsDuration(),
            config.getCameraId());
    }

    public void addListener(MotionListener listener) {
        listeners.add(listener);
    }

    public TickOutcome onFrame(Frame frame, List<CandidateRegion> regions, ZonedDateTime now) {
        Instant instant = now.toInstant();
        expireRecording(instant);

        boolean scheduleActive = scheduleGate.isActive(now);
        boolean confirmed = debouncer.offer(!regions.isEmpty());
        MotionState previous = state;
        state = confirmed && scheduleActive ? MotionState.ACTIVE : MotionState.IDLE;

        if (previous == MotionState.IDLE && state == MotionState.ACTIVE) {
            activeSince = instant;
            emit(instant, EventKind.MOTION_STARTED, regionMetadata(regions));
            if (saveVideos) {
                startRecording(frame, instant);
            }
        }
        if (state == MotionState.ACTIVE) {
            if (lastActive == null || instant.isAfter(lastActive)) {
                lastActive = instant;
            }
            emit(instant, EventKind.MOTION, regionMetadata(regions));
            notifyListeners(instant, regions);
        }
        if (previous == MotionState.ACTIVE && state == MotionState.IDLE) {
            endMotion(instant, scheduleActive ? "no-motion" : "schedule-inactive");
        }

        writeToRecording(frame, instant);

        if (!scheduleActive && !regions.isEmpty()) {
            log.trace("Motion in ROI outside alert hours at {}, {} regions", now, regions.size());
        }
        return TickOutcome.builder()
            .previousState(previous)
            .state(state)
            .calibrating(false)
            .scheduleActive(scheduleActive)
            .motionDetected(!regions.isEmpty())
            .regions(List.copyOf(regions))
            .recording(isRecording())
            .build();
    }

    /**
     * Tick while the background model is calibrating: no decision is made and the state
     * is forced to IDLE. An open recording keeps receiving frames until it expires.
     */
    public TickOutcome onCalibrating(Frame frame, ZonedDateTime now) {
        Instant instant = now.toInstant();
        expireRecording(instant);

        MotionState previous = state;
        state = MotionState.IDLE;
        debouncer.clear();
        if (previous == MotionState.ACTIVE) {
            endMotion(instant, "calibrating");
        }

        writeToRecording(frame, instant);

        return TickOutcome.builder()
            .previousState(previous)
            .state(state)
            .calibrating(true)
            .scheduleActive(scheduleGate.isActive(now))
            .motionDetected(false)
            .recording(isRecording())
            .build();
    }

    public void shutdown(Instant now) {
        if (session != null) {
            closeRecording(now, "shutdown", null);
        }
        if (state == MotionState.ACTIVE) {
            state = MotionState.IDLE;
            endMotion(now, "shutdown");
        }
        debouncer.clear();
    }

    public MotionState state() {
        return state;
    }

    public Optional<Instant> lastActive() {
        return Optional.ofNullable(lastActive);
    }

    public boolean isRecording() {
        return session != null && session.isOpen();
    }

    private void startRecording(Frame frame, Instant instant) {
        if (isRecording()) {
            log.debug("Recording {} already open, not starting another", session.handle().getId());
            return;
        }
        try {
            session = RecordingSession.open(recorder, instant, recordDuration, frame.cols(), frame.rows());
        } catch (RecordingIOException e) {
            log.error("Failed to start recording at {}", instant, e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("frames", 0L);
            metadata.put("elapsed_s", 0.0);
            metadata.put("reason", "error: " + e.getMessage());
            metadata.put("error", e.getMessage());
            emit(instant, EventKind.RECORDING_ENDED, metadata);
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("target", session.handle().getTarget());
        metadata.put("planned_duration_s", recordDuration.toMillis() / 1000.0);
        emit(instant, EventKind.RECORDING_STARTED, metadata);
    }

    private void writeToRecording(Frame frame, Instant instant) {
        if (!isRecording()) {
            return;
        }
        try {
            session.submitFrame(frame);
        } catch (RecordingIOException e) {
            log.error("Recording {} failed, closing it", session.handle().getId(), e);
            closeRecording(instant, "error: " + e.getMessage(), e.getMessage());
        }
    }

    private void expireRecording(Instant instant) {
        if (session != null && session.isExpired(instant)) {
            closeRecording(instant, "duration-reached", null);
        }
    }

    private void closeRecording(Instant instant, String reason, String error) {
        RecordingSession closing = session;
        session = null;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("target", closing.handle().getTarget());
        metadata.put("frames", closing.framesWritten());
        metadata.put("elapsed_s", closing.elapsed(instant).toMillis() / 1000.0);
        metadata.put("reason", reason);
        if (error != null) {
            metadata.put("error", error);
        }
        try {
            closing.close();
        } catch (RecordingIOException e) {
            log.error("Failed to finalize recording {}", closing.handle().getId(), e);
            metadata.put("error", e.getMessage());
        }
        emit(instant, EventKind.RECORDING_ENDED, metadata);
    }

    private void endMotion(Instant instant, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        if (activeSince != null) {
            metadata.put("duration_s", Duration.between(activeSince, instant).toMillis() / 1000.0);
        }
        activeSince = null;
        emit(instant, EventKind.MOTION_ENDED, metadata);
    }

    private Map<String, Object> regionMetadata(List<CandidateRegion> regions) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("regions", regions.size());
        double largest = 0;
        for (CandidateRegion region : regions) {
            largest = Math.max(largest, region.getArea());
        }
        metadata.put("largest_area", largest);
        return metadata;
    }

    private void emit(Instant instant, EventKind kind, Map<String, Object> metadata) {
        Map<String, Object> withCamera = new LinkedHashMap<>();
        withCamera.put("camera_id", cameraId);
        withCamera.putAll(metadata);
        try {
            eventLogger.log(new MotionEvent(instant, kind, withCamera));
        } catch (RuntimeException e) {
            log.error("Event logger rejected {} event", kind.wireName(), e);
        }
    }

    private void notifyListeners(Instant instant, List<CandidateRegion> regions) {
        for (MotionListener listener : listeners) {
            try {
                listener.onMotion(instant, regions);
            } catch (RuntimeException e) {
                log.warn("Motion listener failed", e);
            }
        }
    }
}
