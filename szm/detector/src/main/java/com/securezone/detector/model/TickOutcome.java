package com.securezone.detector.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TickOutcome {

    MotionState previousState;
    MotionState state;
    boolean calibrating;
    boolean scheduleActive;
    boolean motionDetected;
    @Builder.Default
    List<CandidateRegion> regions = List.of();
    boolean recording;

    public boolean isTransition() {
        return previousState != state;
    }

    public boolean isMotionStarted() {
        return previousState == MotionState.IDLE && state == MotionState.ACTIVE;
    }

    public boolean isMotionEnded() {
        return previousState == MotionState.ACTIVE && state == MotionState.IDLE;
    }
}
