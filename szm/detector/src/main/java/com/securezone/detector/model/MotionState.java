package com.securezone.detector.model;

public enum MotionState {
    IDLE,
    ACTIVE
}
