package com.securezone.capture.exception;

/**
 * End of a finite stream. Terminal, not a failure.
 */
public class SourceExhaustedException extends CaptureException {

    public SourceExhaustedException(String message) {
        super(message);
    }
}
