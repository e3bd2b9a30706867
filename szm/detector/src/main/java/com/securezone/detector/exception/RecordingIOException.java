package com.securezone.detector.exception;

public class RecordingIOException extends Exception {

    public RecordingIOException(String message) {
        super(message);
    }

    public RecordingIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
