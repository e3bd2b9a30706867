package com.securezone.detector.model;

public enum CalibrationStatus {
    CALIBRATING,
    READY
}
