package com.securezone.capture.exception;

public class SourceUnavailableException extends CaptureException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
