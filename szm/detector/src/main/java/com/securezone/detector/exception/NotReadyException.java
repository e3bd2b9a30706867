package com.securezone.detector.exception;

public class NotReadyException extends Exception {

    public NotReadyException(int collected, int required) {
        super("Background model calibrating: " + collected + "/" + required + " samples");
    }
}
